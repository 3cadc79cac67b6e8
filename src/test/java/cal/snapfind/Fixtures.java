package cal.snapfind;

import cal.snapfind.repo.JsonObjectFormat;
import cal.snapfind.types.MatchSink;
import cal.snapfind.types.Node;
import cal.snapfind.types.NodeType;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.Tree;
import cal.snapfind.types.TreeStore;

import java.nio.file.NoSuchFileException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Building blocks for tests: entries, trees and snapshots with real ids.
 */
public abstract class Fixtures {

  public static final JsonObjectFormat FORMAT = new JsonObjectFormat();

  private static final ObjectId NO_ID = ObjectId.ofContent(new byte[0]);

  /** Midnight UTC on the given <code>yyyy-mm-dd</code> date. */
  public static Instant day(String date) {
    return LocalDate.parse(date).atStartOfDay(ZoneOffset.UTC).toInstant();
  }

  public static Node file(String name, Instant modTime) {
    return Node.builder()
        .name(name)
        .type(NodeType.FILE)
        .mode(0644)
        .modTime(modTime)
        .uid(1000)
        .gid(1000)
        .user("user")
        .group("users")
        .inode(42)
        .size(123)
        .links(1)
        .build();
  }

  public static Node dir(String name, ObjectId subtree) {
    return Node.builder()
        .name(name)
        .type(NodeType.DIR)
        .mode(0755)
        .modTime(day("2019-01-01"))
        .uid(1000)
        .gid(1000)
        .subtree(subtree)
        .build();
  }

  public static Tree tree(Node... nodes) {
    return new Tree(Arrays.asList(nodes));
  }

  public static ObjectId idOf(Tree tree) {
    return ObjectId.ofContent(FORMAT.serializeTree(tree));
  }

  public static Snapshot snapshot(ObjectId root, Instant time, String hostname, List<String> paths, List<String> tags) {
    Snapshot draft = new Snapshot(NO_ID, time, root, paths, hostname, "user", tags);
    ObjectId id = ObjectId.ofContent(FORMAT.serializeSnapshot(draft));
    return new Snapshot(id, time, root, paths, hostname, "user", tags);
  }

  public static Snapshot snapshot(ObjectId root, Instant time) {
    return snapshot(root, time, "host", List.of("/home/user"), List.of());
  }

  /**
   * Trees held in a map, counting how often each one is loaded.
   */
  public static class MemoryTreeStore implements TreeStore {
    private final Map<ObjectId, Tree> trees = new HashMap<>();
    private final Map<ObjectId, Integer> loads = new HashMap<>();

    public ObjectId add(Tree tree) {
      ObjectId id = idOf(tree);
      trees.put(id, tree);
      return id;
    }

    @Override
    public Tree loadTree(ObjectId id) throws NoSuchFileException {
      Tree tree = trees.get(id);
      if (tree == null) {
        throw new NoSuchFileException(id.toString());
      }
      loads.merge(id, 1, Integer::sum);
      return tree;
    }

    public int loads(ObjectId id) {
      return loads.getOrDefault(id, 0);
    }
  }

  public record Match(ObjectId snapshot, String path) {
  }

  public static class RecordingSink implements MatchSink {
    public final List<Match> matches = new ArrayList<>();
    public int finished = 0;

    @Override
    public void emit(String prefix, Node node, Snapshot snapshot) {
      if (finished > 0) {
        throw new IllegalStateException("emit() after finish()");
      }
      matches.add(new Match(snapshot.id(), Util.joinPath(prefix, node.name())));
    }

    @Override
    public void finish() {
      ++finished;
    }

    public List<String> paths() {
      return matches.stream().map(Match::path).toList();
    }
  }

}
