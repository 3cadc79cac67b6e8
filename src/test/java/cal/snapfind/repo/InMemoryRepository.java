package cal.snapfind.repo;

import cal.prim.storage.ConsistentInMemoryDir;
import cal.snapfind.Fixtures;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.Tree;

import java.time.Instant;
import java.util.List;

/**
 * A {@link Repository} over in-memory directories, with helpers to fill it.
 */
public class InMemoryRepository {

  public final ConsistentInMemoryDir snapshots = new ConsistentInMemoryDir();
  public final ConsistentInMemoryDir trees = new ConsistentInMemoryDir();
  public final ConsistentInMemoryDir locks = new ConsistentInMemoryDir();
  public final Repository repo = new Repository(snapshots, trees, locks, Fixtures.FORMAT);

  public ObjectId putTree(Tree tree) {
    byte[] bytes = Fixtures.FORMAT.serializeTree(tree);
    ObjectId id = ObjectId.ofContent(bytes);
    trees.createOrReplace(id.toString(), bytes);
    return id;
  }

  public Snapshot putSnapshot(ObjectId root, Instant time, String hostname, List<String> paths, List<String> tags) {
    Snapshot sn = Fixtures.snapshot(root, time, hostname, paths, tags);
    snapshots.createOrReplace(sn.id().toString(), Fixtures.FORMAT.serializeSnapshot(sn));
    return sn;
  }

}
