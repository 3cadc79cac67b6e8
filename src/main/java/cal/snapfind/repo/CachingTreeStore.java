package cal.snapfind.repo;

import cal.prim.MalformedDataException;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Tree;
import cal.snapfind.types.TreeStore;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import java.io.IOException;

/**
 * Keeps recently loaded trees in memory so that a tree shared by many snapshots is
 * read and decoded only once.  The cache is bounded by the total number of entries
 * across all cached trees.
 */
public class CachingTreeStore implements TreeStore {

  public static final long DEFAULT_MAX_ENTRIES = 200_000;

  private final TreeStore wrapped;
  private final Cache<ObjectId, Tree> cache;

  public CachingTreeStore(TreeStore wrapped) {
    this(wrapped, DEFAULT_MAX_ENTRIES);
  }

  public CachingTreeStore(TreeStore wrapped, long maxEntries) {
    this.wrapped = wrapped;
    this.cache = CacheBuilder.newBuilder()
        .maximumWeight(maxEntries)
        .weigher((ObjectId id, Tree tree) -> tree.nodes().size() + 1)
        .recordStats()
        .build();
  }

  @Override
  public Tree loadTree(ObjectId id) throws IOException, MalformedDataException {
    Tree tree = cache.getIfPresent(id);
    if (tree == null) {
      tree = wrapped.loadTree(id);
      cache.put(id, tree);
    }
    return tree;
  }

  public CacheStats stats() {
    return cache.stats();
  }

}
