package cal.snapfind.types;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.time.Instant;
import java.util.List;

@Test
public class NodeTests {

  private static final Instant T = Instant.parse("2020-01-01T00:00:00Z");
  private static final ObjectId SOME_TREE = ObjectId.ofContent(new byte[0]);

  @Test
  public void testIllegalNames() {
    for (String name : List.of("", "a/b", "/", "nul\0")) {
      Assert.expectThrows(IllegalArgumentException.class, () -> Node.builder().name(name).type(NodeType.FILE).modTime(T).build());
    }
  }

  @Test
  public void testDirectoriesAndSubtrees() {
    Assert.expectThrows(IllegalArgumentException.class, () -> Node.builder().name("d").type(NodeType.DIR).modTime(T).build());
    Assert.expectThrows(IllegalArgumentException.class, () -> Node.builder().name("f").type(NodeType.FILE).modTime(T).subtree(SOME_TREE).build());
    Node d = Node.builder().name("d").type(NodeType.DIR).modTime(T).subtree(SOME_TREE).build();
    Assert.assertTrue(d.isDirectory());
    Assert.assertEquals(d.subtree(), SOME_TREE);
  }

  @Test
  public void testDefaults() {
    Node n = Node.builder().name("x").modTime(T).build();
    Assert.assertEquals(n.type(), NodeType.OTHER);
    Assert.assertEquals(n.content(), List.of());
    Assert.assertEquals(n.extendedAttributes(), List.of());
    Assert.assertFalse(n.isDirectory());
  }

  @Test
  public void testObjectIds() {
    String hex = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";
    Assert.assertEquals(SOME_TREE.toString(), hex);
    Assert.assertEquals(SOME_TREE.str(), "e3b0c442");
    Assert.assertEquals(ObjectId.parse(hex.toUpperCase()), SOME_TREE);
    Assert.expectThrows(IllegalArgumentException.class, () -> ObjectId.parse("e3b0c442"));
    Assert.expectThrows(IllegalArgumentException.class, () -> ObjectId.parse(hex.replace('e', 'g')));
  }

  @Test
  public void testNodeTypeNames() {
    Assert.assertEquals(NodeType.fromSerializedName("dir"), NodeType.DIR);
    Assert.assertEquals(NodeType.fromSerializedName("chardev"), NodeType.CHARDEV);
    Assert.assertEquals(NodeType.fromSerializedName("whiteout"), NodeType.OTHER);
  }

}
