package cal.snapfind.impls;

import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.List;

import static cal.snapfind.Fixtures.day;
import static cal.snapfind.Fixtures.file;
import static cal.snapfind.Fixtures.snapshot;

@Test
public class TextOutputTests {

  private final ObjectId someTree = ObjectId.ofContent(new byte[0]);
  private final Snapshot first = snapshot(someTree, day("2022-01-01"));
  private final Snapshot second = snapshot(someTree, day("2022-02-01"));

  private static List<String> lines(ByteArrayOutputStream bytes) {
    return bytes.toString(StandardCharsets.UTF_8).lines().toList();
  }

  private static void emitSample(TextOutput output, Snapshot first, Snapshot second) {
    output.emit("/", file("a.txt", day("2020-01-01")), first);
    output.emit("/sub", file("b.txt", day("2020-01-01")), first);
    output.emit("/sub", file("b.txt", day("2020-01-01")), second);
    output.finish();
  }

  @Test
  public void testHeaders() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    emitSample(new TextOutput(out, out, new NodeFormatter(false, ZoneOffset.UTC)), first, second);
    Assert.assertEquals(lines(bytes), List.of(
        "Found matching entries in snapshot " + first.id(),
        "/a.txt",
        "/sub/b.txt",
        "",
        "Found matching entries in snapshot " + second.id(),
        "/sub/b.txt"));
  }

  @Test
  public void testQuiet() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    emitSample(new TextOutput(out, null, new NodeFormatter(false, ZoneOffset.UTC)), first, second);
    Assert.assertEquals(lines(bytes), List.of("/a.txt", "/sub/b.txt", "/sub/b.txt"));
  }

  @Test
  public void testHeadersOnSeparateStream() {
    ByteArrayOutputStream results = new ByteArrayOutputStream();
    ByteArrayOutputStream headers = new ByteArrayOutputStream();
    emitSample(new TextOutput(
        new PrintStream(results, true, StandardCharsets.UTF_8),
        new PrintStream(headers, true, StandardCharsets.UTF_8),
        new NodeFormatter(true, ZoneOffset.UTC)), first, second);
    Assert.assertEquals(lines(results), List.of(
        "-rw-r--r--  1000  1000    123 2020-01-01 00:00:00 /a.txt",
        "-rw-r--r--  1000  1000    123 2020-01-01 00:00:00 /sub/b.txt",
        "-rw-r--r--  1000  1000    123 2020-01-01 00:00:00 /sub/b.txt"));
    Assert.assertEquals(lines(headers), List.of(
        "Found matching entries in snapshot " + first.id(),
        "",
        "Found matching entries in snapshot " + second.id()));
  }

  @Test
  public void testNoMatches() {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    new TextOutput(out, out, new NodeFormatter(false, ZoneOffset.UTC)).finish();
    Assert.assertEquals(bytes.size(), 0);
  }

}
