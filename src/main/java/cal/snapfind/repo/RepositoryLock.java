package cal.snapfind.repo;

import cal.prim.MalformedDataException;
import cal.prim.storage.EventuallyConsistentDirectory;
import cal.prim.time.UnreliableWallClock;
import cal.snapfind.Util;
import cal.snapfind.types.ObjectId;
import com.google.common.util.concurrent.Uninterruptibles;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A non-exclusive lock on a repository.  Any number of readers may hold one at the
 * same time; they only keep out processes that want exclusive access (for instance
 * to delete data), and are kept out by them in turn.
 *
 * <p>A lock is a small file in the repository's <code>locks</code> directory.  Locks
 * left behind by crashed processes are ignored once they are {@link #isStale stale}.
 * A long search must therefore {@link #refresh() refresh} its lock well within
 * {@link #STALE_AFTER}; {@link #keepFresh(Duration, PrintStream)} does so from a
 * background thread until the lock is closed.
 *
 * <p>Use with try-with-resources:
 * <pre>
 *   try (RepositoryLock lock = repo.lockShared(clock)) {
 *     // read from the repository
 *   }
 * </pre>
 */
public final class RepositoryLock implements Closeable {

  /** Locks older than this are assumed to belong to processes that died. */
  public static final Duration STALE_AFTER = Duration.ofMinutes(30);

  /** How often {@link #keepFresh(Duration, PrintStream)} should rewrite a held lock. */
  public static final Duration REFRESH_INTERVAL = Duration.ofMinutes(5);

  public record Info(Instant time, boolean exclusive, String hostname, String username, long pid) {
  }

  private final EventuallyConsistentDirectory locks;
  private final JsonObjectFormat format;
  private final UnreliableWallClock clock;
  private final Info owner;
  private String name;
  private boolean released = false;
  private @Nullable Thread refresher = null;

  private RepositoryLock(EventuallyConsistentDirectory locks, JsonObjectFormat format, UnreliableWallClock clock, Info owner, String name) {
    this.locks = locks;
    this.format = format;
    this.clock = clock;
    this.owner = owner;
    this.name = name;
  }

  /**
   * Acquire a shared lock for the given owner.
   *
   * @throws RepositoryLockedException if another process holds a live exclusive lock
   * @throws MalformedDataException if an existing lock file cannot be understood
   */
  public static RepositoryLock acquireShared(
      EventuallyConsistentDirectory locks,
      JsonObjectFormat format,
      UnreliableWallClock clock,
      String hostname,
      String username,
      long pid) throws IOException, MalformedDataException {
    Instant now = clock.now();
    checkForExclusiveLocks(locks, format, now, hostname, null);

    Info mine = new Info(now, false, hostname, username, pid);
    byte[] bytes = format.serializeLock(mine);
    String name = ObjectId.ofContent(bytes).toString();
    locks.createOrReplace(name, new ByteArrayInputStream(bytes));
    RepositoryLock lock = new RepositoryLock(locks, format, clock, mine, name);

    // An exclusive lock may have been taken between the check and the creation.
    try {
      checkForExclusiveLocks(locks, format, now, hostname, name);
    } catch (Exception e) {
      try {
        lock.close();
      } catch (IOException onClose) {
        e.addSuppressed(onClose);
      }
      throw e;
    }
    return lock;
  }

  private static void checkForExclusiveLocks(
      EventuallyConsistentDirectory locks,
      JsonObjectFormat format,
      Instant now,
      String hostname,
      @Nullable String ownName) throws IOException, MalformedDataException {
    List<String> names;
    try (var s = locks.list()) {
      names = s.toList();
    }
    for (String other : names) {
      if (other.equals(ownName)) {
        continue;
      }
      Info info;
      try (InputStream in = locks.open(other)) {
        info = format.loadLock(Util.read(in));
      } catch (NoSuchFileException released) {
        // released between list() and open()
        continue;
      }
      if (info.exclusive() && !isStale(info, now, hostname)) {
        throw new RepositoryLockedException(info);
      }
    }
  }

  /**
   * A lock is stale if it is older than {@link #STALE_AFTER}, or if it was taken on this
   * host by a process that no longer exists.
   */
  public static boolean isStale(Info info, Instant now, String currentHostname) {
    if (Duration.between(info.time(), now).compareTo(STALE_AFTER) > 0) {
      return true;
    }
    if (info.hostname().equals(currentHostname)) {
      Optional<ProcessHandle> process = ProcessHandle.of(info.pid());
      return process.isEmpty() || !process.get().isAlive();
    }
    return false;
  }

  synchronized String name() {
    return name;
  }

  /**
   * Rewrite the lock file with the current time, so that other processes do not
   * consider it stale.  Lock files are named by their content, so the refreshed
   * lock gets a new name and the old file is removed.  Does nothing once the lock
   * has been released.
   */
  public synchronized void refresh() throws IOException {
    if (released) {
      return;
    }
    byte[] bytes = format.serializeLock(new Info(clock.now(), owner.exclusive(), owner.hostname(), owner.username(), owner.pid()));
    String newName = ObjectId.ofContent(bytes).toString();
    if (newName.equals(name)) {
      return;
    }
    locks.createOrReplace(newName, new ByteArrayInputStream(bytes));
    String oldName = name;
    name = newName;
    deleteIfPresent(oldName);
  }

  /**
   * Start a daemon thread that calls {@link #refresh()} every <code>interval</code>
   * until this lock is closed.  Refresh failures are reported on <code>warnings</code>
   * and retried at the next interval.
   */
  public synchronized void keepFresh(Duration interval, PrintStream warnings) {
    if (released || refresher != null) {
      return;
    }
    Thread t = new Thread(() -> {
      for (;;) {
        try {
          Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
          return;
        }
        try {
          refresh();
        } catch (IOException e) {
          if (Thread.currentThread().isInterrupted()) {
            return;
          }
          warnings.println("WARNING: unable to refresh the repository lock: " + e);
        }
      }
    }, "repository-lock-refresher");
    t.setDaemon(true);
    refresher = t;
    t.start();
  }

  private void deleteIfPresent(String lockName) throws IOException {
    try {
      locks.delete(lockName);
    } catch (NoSuchFileException alreadyGone) {
      // removed by another process that judged it stale
    }
  }

  /**
   * Release the lock.  Closing an already-released lock does nothing, and neither
   * does closing a lock whose file has already been removed.
   */
  @Override
  public void close() throws IOException {
    Thread t;
    synchronized (this) {
      t = refresher;
      refresher = null;
    }
    if (t != null) {
      t.interrupt();
      Uninterruptibles.joinUninterruptibly(t);
    }

    String toDelete;
    synchronized (this) {
      if (released) {
        return;
      }
      released = true;
      toDelete = name;
    }
    deleteIfPresent(toDelete);
  }

}
