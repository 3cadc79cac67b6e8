package cal.snapfind.types;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Locale;

/**
 * What to look for: a glob over entry names and an inclusive window over
 * modification times.  A null bound leaves that side of the window open.
 *
 * <p>When <code>ignoreCase</code> is set the glob has already been lower-cased,
 * and names must be lower-cased with {@link #foldCase(String)} before matching.
 */
public record FindPattern(
    GlobPattern glob,
    boolean ignoreCase,
    @Nullable Instant oldest,
    @Nullable Instant newest) {

  public static FindPattern of(String pattern, boolean ignoreCase, @Nullable Instant oldest, @Nullable Instant newest) throws BadPatternException {
    String glob = ignoreCase ? pattern.toLowerCase(Locale.ROOT) : pattern;
    return new FindPattern(GlobPattern.compile(glob), ignoreCase, oldest, newest);
  }

  public String foldCase(String name) {
    return ignoreCase ? name.toLowerCase(Locale.ROOT) : name;
  }

  public boolean tooOld(Instant modTime) {
    return oldest != null && modTime.isBefore(oldest);
  }

  public boolean tooNew(Instant modTime) {
    return newest != null && modTime.isAfter(newest);
  }

  @Override
  public String toString() {
    return '"' + glob.toString() + '"' + (ignoreCase ? " (ignoring case)" : "") + " within [" + (oldest != null ? oldest : "-") + ", " + (newest != null ? newest : "-") + ']';
  }

}
