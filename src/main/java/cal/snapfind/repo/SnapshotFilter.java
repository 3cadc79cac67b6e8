package cal.snapfind.repo;

import cal.prim.MalformedDataException;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import cal.snapfind.types.SnapshotSource;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a {@link SnapshotSelection} into the sequence of snapshots to search.
 *
 * <p>Explicit snapshot ids are resolved one at a time, as the search asks for the next
 * snapshot, in the order they were given.  Each may be a unique prefix of an id or the
 * word <code>latest</code>, meaning the most recent snapshot of the selected host and
 * paths.  Ids that cannot be resolved are reported as warnings and skipped; a snapshot
 * named twice is searched once.
 *
 * <p>Without explicit ids, every matching snapshot is selected, oldest first.
 */
public class SnapshotFilter {

  public static final String LATEST = "latest";

  public static SnapshotSource select(Repository repo, SnapshotSelection selection, PrintStream warnings) throws IOException, MalformedDataException {
    if (!selection.getSnapshotIds().isEmpty()) {
      return new ExplicitSnapshots(repo, selection, warnings);
    }
    List<Snapshot> result = new ArrayList<>();
    for (Snapshot sn : loadAll(repo)) {
      if (matches(sn, selection, true)) {
        result.add(sn);
      }
    }
    result.sort(BY_TIME);
    return SnapshotSource.of(result);
  }

  private static final Comparator<Snapshot> BY_TIME =
      Comparator.comparing(Snapshot::time).thenComparing(sn -> sn.id().toString());

  static boolean matches(Snapshot sn, SnapshotSelection selection, boolean checkTags) {
    String host = selection.getHost();
    if (host != null && !host.equals(sn.hostname())) {
      return false;
    }
    if (checkTags && !sn.hasTags(selection.getTags())) {
      return false;
    }
    return sn.hasPaths(selection.getPaths());
  }

  private static List<Snapshot> loadAll(Repository repo) throws IOException, MalformedDataException {
    List<Snapshot> result = new ArrayList<>();
    for (ObjectId id : repo.listSnapshotIds()) {
      result.add(repo.loadSnapshot(id));
    }
    return result;
  }

  private static final class ExplicitSnapshots implements SnapshotSource {
    private final Repository repo;
    private final SnapshotSelection selection;
    private final PrintStream warnings;
    private final Iterator<String> remaining;
    private final Set<ObjectId> seen = new HashSet<>();
    private @Nullable List<ObjectId> allIds = null;

    ExplicitSnapshots(Repository repo, SnapshotSelection selection, PrintStream warnings) {
      this.repo = repo;
      this.selection = selection;
      this.warnings = warnings;
      this.remaining = new LinkedHashSet<>(selection.getSnapshotIds()).iterator();
    }

    @Override
    public @Nullable Snapshot next() throws IOException, MalformedDataException {
      while (remaining.hasNext()) {
        String given = remaining.next();
        Snapshot sn;
        try {
          sn = resolve(given);
        } catch (NoSuchSnapshotException e) {
          warnings.println("WARNING: ignoring snapshot \"" + given + "\": " + e.getMessage());
          continue;
        }
        if (seen.add(sn.id())) {
          return sn;
        }
      }
      return null;
    }

    private Snapshot resolve(String given) throws IOException, MalformedDataException, NoSuchSnapshotException {
      if (given.equals(LATEST)) {
        Snapshot latest = null;
        for (Snapshot sn : loadAll(repo)) {
          // tags do not restrict "latest"
          if (matches(sn, selection, false) && (latest == null || BY_TIME.compare(sn, latest) > 0)) {
            latest = sn;
          }
        }
        if (latest == null) {
          throw new NoSuchSnapshotException("no snapshot matches the host and paths");
        }
        return latest;
      }
      List<ObjectId> ids = allIds;
      if (ids == null) {
        ids = repo.listSnapshotIds();
        allIds = ids;
      }
      return repo.loadSnapshot(Repository.resolvePrefix(given.toLowerCase(Locale.ROOT), ids));
    }
  }

}
