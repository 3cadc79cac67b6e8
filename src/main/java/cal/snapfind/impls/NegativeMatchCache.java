package cal.snapfind.impls;

import cal.snapfind.types.ObjectId;

import java.util.HashSet;
import java.util.Set;

/**
 * Ids of trees known to contain no match anywhere below them.
 *
 * <p>An entry is only valid for the pattern it was computed with.  The cache is
 * therefore created by, and private to, one {@link Finder}, whose pattern never
 * changes.  Only ids are kept, never tree contents.
 */
final class NegativeMatchCache {

  private final Set<ObjectId> noMatches = new HashSet<>();
  private long hits = 0;

  boolean knownEmpty(ObjectId tree) {
    boolean known = noMatches.contains(tree);
    if (known) {
      ++hits;
    }
    return known;
  }

  void recordEmpty(ObjectId tree) {
    noMatches.add(tree);
  }

  /**
   * @return how many times a lookup avoided searching a tree
   */
  long hits() {
    return hits;
  }

}
