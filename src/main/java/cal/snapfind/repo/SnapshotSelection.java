package cal.snapfind.repo;

import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * Which snapshots to search.  Explicit ids win; otherwise every snapshot that
 * matches the host, carries all the tags and contains all the paths is selected.
 * Empty lists and a null host do not restrict anything.
 */
@Value
public class SnapshotSelection {
  @Nullable String host;
  List<String> tags;
  List<String> paths;
  List<String> snapshotIds;
}
