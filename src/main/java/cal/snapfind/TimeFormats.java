package cal.snapfind;

import cal.snapfind.types.UsageException;
import com.google.common.collect.ImmutableList;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;

/**
 * Parsing of the date/time strings accepted by <code>--oldest</code> and
 * <code>--newest</code>.  Times without an explicit zone or offset are in the
 * given default zone; dates without a time mean the start of that day.
 */
public abstract class TimeFormats {

  private static final List<DateTimeFormatter> FORMATS = ImmutableList.of(
      "yyyy-MM-dd",
      "yyyy-MM-dd HH:mm",
      "yyyy-MM-dd HH:mm:ss",
      "yyyy-MM-dd HH:mm:ss Z",
      "yyyy-MM-dd HH:mm:ss z",
      "dd.MM.yyyy",
      "dd.MM.yyyy HH:mm",
      "dd.MM.yyyy HH:mm:ss",
      "dd.MM.yyyy HH:mm:ss Z",
      "dd.MM.yyyy HH:mm:ss z",
      "EEE MMM d HH:mm:ss Z z yyyy"
  ).stream().map(p -> DateTimeFormatter.ofPattern(p, Locale.US)).collect(ImmutableList.toImmutableList());

  public static Instant parse(String str, ZoneId defaultZone) throws UsageException {
    for (DateTimeFormatter format : FORMATS) {
      TemporalAccessor t;
      try {
        t = format.parseBest(str, ZonedDateTime::from, LocalDateTime::from, LocalDate::from);
      } catch (DateTimeParseException ignored) {
        // try the next format
        continue;
      }
      if (t instanceof ZonedDateTime z) {
        return z.toInstant();
      } else if (t instanceof LocalDateTime l) {
        return l.atZone(defaultZone).toInstant();
      } else if (t instanceof LocalDate d) {
        return d.atStartOfDay(defaultZone).toInstant();
      }
    }
    throw new UsageException("unable to parse time: \"" + str + '"');
  }

}
