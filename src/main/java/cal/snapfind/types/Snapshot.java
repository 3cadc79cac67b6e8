package cal.snapfind.types;

import com.google.common.collect.ImmutableList;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * A point-in-time backup of some paths on one host.
 *
 * @param id the id the snapshot is stored under
 * @param tree the id of the root directory
 * @param paths the backed-up paths
 */
public record Snapshot(
    ObjectId id,
    Instant time,
    ObjectId tree,
    List<String> paths,
    String hostname,
    @Nullable String username,
    List<String> tags) {

  public Snapshot {
    paths = ImmutableList.copyOf(paths);
    tags = ImmutableList.copyOf(tags);
  }

  /**
   * @return true if this snapshot carries every one of the given tags
   */
  public boolean hasTags(Collection<String> wanted) {
    return tags.containsAll(wanted);
  }

  /**
   * @return true if every one of the given paths was backed up by this snapshot
   */
  public boolean hasPaths(Collection<String> wanted) {
    return paths.containsAll(wanted);
  }

  @Override
  public String toString() {
    return "snapshot " + id.str() + " of " + paths + " at " + time + " by " + username + '@' + hostname;
  }

}
