package cal.snapfind.repo;

import cal.prim.MalformedDataException;
import cal.prim.storage.EventuallyConsistentDirectory;
import cal.prim.storage.LocalDirectory;
import cal.prim.time.UnreliableWallClock;
import cal.snapfind.Util;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.Tree;
import cal.snapfind.types.TreeStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * A read-only view of a content-addressed snapshot repository.
 *
 * <p>A repository has three directories:
 * <pre>
 *   snapshots/&lt;id&gt;   one JSON snapshot per file
 *   trees/&lt;id&gt;       one JSON tree per file
 *   locks/&lt;id&gt;       one JSON lock per process using the repository
 * </pre>
 * where the id of every snapshot and tree is the SHA-256 of its file.  Objects are
 * checked against their id when they are loaded.  See {@link JsonObjectFormat}.
 */
public class Repository implements TreeStore {

  private final EventuallyConsistentDirectory snapshots;
  private final EventuallyConsistentDirectory trees;
  private final EventuallyConsistentDirectory locks;
  private final JsonObjectFormat format;

  public Repository(
      EventuallyConsistentDirectory snapshots,
      EventuallyConsistentDirectory trees,
      EventuallyConsistentDirectory locks,
      JsonObjectFormat format) {
    this.snapshots = snapshots;
    this.trees = trees;
    this.locks = locks;
    this.format = format;
  }

  /**
   * Open the repository stored in a local directory.
   *
   * @throws java.nio.file.NoSuchFileException if <code>root</code> or one of its three
   *   directories does not exist
   */
  public static Repository open(Path root) throws IOException {
    return new Repository(
        new LocalDirectory(root.resolve("snapshots")),
        new LocalDirectory(root.resolve("trees")),
        new LocalDirectory(root.resolve("locks")),
        new JsonObjectFormat());
  }

  private byte[] readVerified(EventuallyConsistentDirectory dir, ObjectId id, String kind) throws IOException, MalformedDataException {
    if (Thread.currentThread().isInterrupted()) {
      throw new InterruptedIOException("interrupted while loading " + kind + ' ' + id.str());
    }
    byte[] data;
    try (InputStream in = dir.open(id.toString())) {
      data = Util.read(in);
    }
    ObjectId actual = ObjectId.ofContent(data);
    if (!actual.equals(id)) {
      throw new MalformedDataException("The " + kind + " stored as " + id + " has id " + actual);
    }
    return data;
  }

  @Override
  public Tree loadTree(ObjectId id) throws IOException, MalformedDataException {
    return format.loadTree(readVerified(trees, id, "tree"));
  }

  public Snapshot loadSnapshot(ObjectId id) throws IOException, MalformedDataException {
    return format.loadSnapshot(id, readVerified(snapshots, id, "snapshot"));
  }

  /**
   * @return the ids of all snapshots, in no particular order
   * @throws MalformedDataException if the snapshot directory holds something that is not a snapshot id
   */
  public List<ObjectId> listSnapshotIds() throws IOException, MalformedDataException {
    List<ObjectId> result = new ArrayList<>();
    try (Stream<String> names = snapshots.list()) {
      for (String name : (Iterable<String>) names::iterator) {
        try {
          result.add(ObjectId.parse(name));
        } catch (IllegalArgumentException e) {
          throw new MalformedDataException("Unexpected file \"" + name + "\" among the snapshots", e);
        }
      }
    }
    return result;
  }

  /**
   * Find the one snapshot whose id starts with the given hexadecimal prefix.
   *
   * @throws NoSuchSnapshotException if no snapshot, or more than one, has that prefix
   */
  public ObjectId findSnapshot(String prefix) throws IOException, MalformedDataException, NoSuchSnapshotException {
    return resolvePrefix(prefix, listSnapshotIds());
  }

  static ObjectId resolvePrefix(String prefix, List<ObjectId> candidates) throws NoSuchSnapshotException {
    if (prefix.isEmpty()) {
      throw new NoSuchSnapshotException("empty snapshot id");
    }
    ObjectId found = null;
    for (ObjectId id : candidates) {
      if (id.toString().startsWith(prefix)) {
        if (found != null && !found.equals(id)) {
          throw new NoSuchSnapshotException("snapshot id prefix " + prefix + " is ambiguous");
        }
        found = id;
      }
    }
    if (found == null) {
      throw new NoSuchSnapshotException("no snapshot has an id starting with " + prefix);
    }
    return found;
  }

  /**
   * Take a shared lock on behalf of this process.
   *
   * @throws RepositoryLockedException if another process holds an exclusive lock
   */
  public RepositoryLock lockShared(UnreliableWallClock clock) throws IOException, MalformedDataException {
    return RepositoryLock.acquireShared(
        locks,
        format,
        clock,
        currentHostname(),
        System.getProperty("user.name", ""),
        ProcessHandle.current().pid());
  }

  private static String currentHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      // Only used to label our lock and to recognize our own host's stale locks.
      return "localhost";
    }
  }

}
