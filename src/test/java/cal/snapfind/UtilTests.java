package cal.snapfind;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;

@Test
public class UtilTests {

  private final String SHA256_FOR_ZERO_BYTES = "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

  @Test
  public void testSha256() {
    byte[] sha256bytes = Util.sha256(new byte[0]);
    String sha256string = Util.sha256toString(sha256bytes);
    Assert.assertEquals(sha256string, SHA256_FOR_ZERO_BYTES);
    byte[] sha256bytes2 = Util.stringToSha256(sha256string);
    Assert.assertEquals(sha256bytes2, sha256bytes);
  }

  @Test
  public void testBadSha256() {
    Assert.expectThrows(IllegalArgumentException.class, () -> Util.stringToSha256("abc"));
    Assert.expectThrows(IllegalArgumentException.class, () -> Util.stringToSha256(SHA256_FOR_ZERO_BYTES.replace('e', 'x')));
  }

  @Test
  public void testRead() throws IOException {
    byte[] data = new byte[Util.SUGGESTED_BUFFER_SIZE * 3 + 17];
    for (int i = 0; i < data.length; ++i) {
      data[i] = (byte) i;
    }
    Assert.assertEquals(Util.read(new ByteArrayInputStream(data)), data);
  }

  @Test
  public void testJoinPath() {
    Assert.assertEquals(Util.joinPath("/", "a"), "/a");
    Assert.assertEquals(Util.joinPath("/a", "b"), "/a/b");
    Assert.assertEquals(Util.joinPath("/a/b", "c.txt"), "/a/b/c.txt");
  }

}
