package cal.snapfind.impls;

import cal.prim.MalformedDataException;
import cal.snapfind.Util;
import cal.snapfind.types.FindPattern;
import cal.snapfind.types.MatchSink;
import cal.snapfind.types.Node;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.SnapshotSource;
import cal.snapfind.types.Tree;
import cal.snapfind.types.TreeStore;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;

/**
 * Searches snapshots for entries whose name matches a {@link FindPattern} and
 * whose modification time falls inside the pattern's window.
 *
 * <p>Snapshots usually share most of their directories.  Because tree ids are
 * content hashes, a tree that produced no match once will produce no match
 * wherever it appears again, so the finder remembers such trees and never
 * searches them twice.  Trees that do contain matches are searched each time
 * they are reached, since every occurrence has to be reported.
 *
 * <p>The time window only filters matches.  Directories are always searched,
 * whatever their own name or modification time.
 *
 * <p>Instances are not thread-safe.  One instance serves one search.
 */
public class Finder {

  private final TreeStore trees;
  private final FindPattern pattern;
  private final MatchSink out;
  private final NegativeMatchCache notFound = new NegativeMatchCache();

  private long treesSearched = 0;
  private long matches = 0;

  public Finder(TreeStore trees, FindPattern pattern, MatchSink out) {
    this.trees = Objects.requireNonNull(trees);
    this.pattern = Objects.requireNonNull(pattern);
    this.out = Objects.requireNonNull(out);
  }

  /**
   * Search every snapshot from <code>snapshots</code>, one after another, and then
   * {@link MatchSink#finish() finish} the output.  The output is finished even if the
   * search fails, so that matches already written stay well-formed.
   *
   * @throws InterruptedIOException if the current thread is interrupted between snapshots
   * @throws IOException if a snapshot or tree could not be loaded; matches already reported
   *   remain valid
   * @throws MalformedDataException if a stored snapshot or tree is corrupt
   */
  public void findAll(SnapshotSource snapshots) throws IOException, MalformedDataException {
    try {
      for (Snapshot sn = snapshots.next(); sn != null; sn = snapshots.next()) {
        if (Thread.currentThread().isInterrupted()) {
          throw new InterruptedIOException("search interrupted");
        }
        findInSnapshot(sn);
      }
    } catch (Exception e) {
      try {
        out.finish();
      } catch (IOException onFinish) {
        e.addSuppressed(onFinish);
      }
      throw e;
    }
    out.finish();
  }

  /**
   * Search one snapshot, reporting its matches to the output in traversal order.
   */
  public void findInSnapshot(Snapshot sn) throws IOException, MalformedDataException {
    findInTree(sn.tree(), "/", sn);
  }

  /**
   * @return true if the tree or anything below it matched
   */
  private boolean findInTree(ObjectId treeId, String prefix, Snapshot sn) throws IOException, MalformedDataException {
    if (notFound.knownEmpty(treeId)) {
      return false;
    }

    Tree tree = trees.loadTree(treeId);
    ++treesSearched;

    boolean found = false;
    for (Node node : tree.nodes()) {
      if (pattern.glob().matches(pattern.foldCase(node.name()))
          && !pattern.tooOld(node.modTime())
          && !pattern.tooNew(node.modTime())) {
        found = true;
        ++matches;
        out.emit(prefix, node, sn);
      }

      if (node.isDirectory()) {
        // subtree is never null for directories; see Node
        ObjectId subtree = Objects.requireNonNull(node.subtree());
        if (findInTree(subtree, Util.joinPath(prefix, node.name()), sn)) {
          found = true;
        }
      }
    }

    if (!found) {
      notFound.recordEmpty(treeId);
    }
    return found;
  }

  public FindPattern pattern() {
    return pattern;
  }

  /**
   * @return how many trees were loaded and searched so far
   */
  public long treesSearched() {
    return treesSearched;
  }

  /**
   * @return how many trees were skipped because they were already known to have no match
   */
  public long treesSkipped() {
    return notFound.hits();
  }

  public long matches() {
    return matches;
  }

}
