package cal.snapfind.impls;

import cal.snapfind.types.Node;
import cal.snapfind.types.NodeType;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;

import static cal.snapfind.Fixtures.day;
import static cal.snapfind.Fixtures.file;

@Test
public class NodeFormatterTests {

  private final NodeFormatter shortForm = new NodeFormatter(false, ZoneOffset.UTC);
  private final NodeFormatter longForm = new NodeFormatter(true, ZoneOffset.UTC);

  @Test
  public void testPaths() {
    Assert.assertEquals(shortForm.format("/", file("a.txt", day("2020-01-01"))), "/a.txt");
    Assert.assertEquals(shortForm.format("/home/user", file("a.txt", day("2020-01-01"))), "/home/user/a.txt");
  }

  @Test
  public void testLongListing() {
    Assert.assertEquals(
        longForm.format("/", file("a.txt", day("2020-01-01"))),
        "-rw-r--r--  1000  1000    123 2020-01-01 00:00:00 /a.txt");
  }

  @Test
  public void testLongListingUsesZone() {
    NodeFormatter berlin = new NodeFormatter(true, ZoneId.of("Europe/Berlin"));
    Assert.assertEquals(
        berlin.format("/sub", file("b.txt", day("2021-06-01"))),
        "-rw-r--r--  1000  1000    123 2021-06-01 02:00:00 /sub/b.txt");
  }

  @Test
  public void testSymlink() {
    Node link = Node.builder()
        .name("passwd")
        .type(NodeType.SYMLINK)
        .mode(0777)
        .modTime(day("2020-01-01"))
        .size(11)
        .linkTarget("/etc/passwd")
        .build();
    Assert.assertEquals(longForm.format("/", link), "Lrwxrwxrwx     0     0     11 2020-01-01 00:00:00 /passwd -> /etc/passwd");
    Assert.assertEquals(shortForm.format("/", link), "/passwd");
  }

  @Test
  public void testOtherKinds() {
    Node fifo = Node.builder().name("p").type(NodeType.FIFO).mode(0644).modTime(day("2020-01-01")).build();
    Assert.assertEquals(longForm.format("/", fifo), "<Node(fifo) p>");
    Assert.assertEquals(shortForm.format("/", fifo), "/p");
  }

  @Test
  public void testUnknownKindShowsStoredName() {
    Node whiteout = Node.builder().name("w").typeName("whiteout").mode(0).modTime(day("2020-01-01")).build();
    Assert.assertEquals(whiteout.type(), NodeType.OTHER);
    Assert.assertEquals(longForm.format("/", whiteout), "<Node(whiteout) w>");
    Assert.assertEquals(shortForm.format("/", whiteout), "/w");
  }

}
