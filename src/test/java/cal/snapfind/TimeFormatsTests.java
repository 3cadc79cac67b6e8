package cal.snapfind;

import cal.snapfind.types.UsageException;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Test
public class TimeFormatsTests {

  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

  @Test
  public void testDates() throws UsageException {
    Assert.assertEquals(TimeFormats.parse("2020-01-02", ZoneOffset.UTC), Instant.parse("2020-01-02T00:00:00Z"));
    Assert.assertEquals(TimeFormats.parse("2020-01-02", BERLIN), Instant.parse("2020-01-01T23:00:00Z"));
    Assert.assertEquals(TimeFormats.parse("02.01.2020", ZoneOffset.UTC), Instant.parse("2020-01-02T00:00:00Z"));
  }

  @Test
  public void testDateTimes() throws UsageException {
    Assert.assertEquals(TimeFormats.parse("2020-01-02 03:04", ZoneOffset.UTC), Instant.parse("2020-01-02T03:04:00Z"));
    Assert.assertEquals(TimeFormats.parse("2020-01-02 03:04:05", ZoneOffset.UTC), Instant.parse("2020-01-02T03:04:05Z"));
    Assert.assertEquals(TimeFormats.parse("02.01.2020 03:04", ZoneOffset.UTC), Instant.parse("2020-01-02T03:04:00Z"));
    Assert.assertEquals(TimeFormats.parse("02.01.2020 03:04:05", BERLIN), Instant.parse("2020-01-02T02:04:05Z"));
  }

  @Test
  public void testExplicitOffsetWins() throws UsageException {
    Assert.assertEquals(TimeFormats.parse("2020-01-02 03:04:05 -0700", BERLIN), Instant.parse("2020-01-02T10:04:05Z"));
    Assert.assertEquals(TimeFormats.parse("02.01.2020 03:04:05 +0100", ZoneOffset.UTC), Instant.parse("2020-01-02T02:04:05Z"));
  }

  @Test
  public void testGarbage() {
    for (String s : new String[] { "", "yesterday", "2020-13-01", "2020-01-02T03:04:05Z", "2020/01/02" }) {
      UsageException e = Assert.expectThrows(UsageException.class, () -> TimeFormats.parse(s, ZoneOffset.UTC));
      Assert.assertEquals(e.getMessage(), "unable to parse time: \"" + s + '"');
    }
  }

}
