package cal.snapfind.types;

import cal.prim.MalformedDataException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.Iterator;

/**
 * A finite sequence of snapshots that can be walked once.  Snapshots may be
 * loaded lazily, so each step may fail.
 */
@FunctionalInterface
public interface SnapshotSource {

  /**
   * @return the next snapshot, or null when there are no more
   */
  @Nullable Snapshot next() throws IOException, MalformedDataException;

  static SnapshotSource of(Iterable<Snapshot> snapshots) {
    Iterator<Snapshot> it = snapshots.iterator();
    return () -> it.hasNext() ? it.next() : null;
  }

}
