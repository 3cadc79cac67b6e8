package cal.snapfind.types;

import cal.snapfind.Util;

import java.util.Arrays;
import java.util.Objects;

/**
 * The identifier of a stored tree or snapshot: the SHA-256 of its serialized
 * bytes.  Two objects with equal ids have equal content, so anything learned
 * about one tree holds for every other occurrence of the same id, in any
 * snapshot and under any path.
 */
public record ObjectId(byte[] sha256) {

  public ObjectId {
    Objects.requireNonNull(sha256);
    if (sha256.length != 32) {
      throw new IllegalArgumentException("array is the wrong length to be a sha256 checksum");
    }
    sha256 = sha256.clone();
  }

  public static ObjectId ofContent(byte[] content) {
    return new ObjectId(Util.sha256(content));
  }

  /**
   * Parse 64 hexadecimal digits.
   *
   * @throws IllegalArgumentException if <code>hex</code> is not a full id
   */
  public static ObjectId parse(String hex) {
    return new ObjectId(Util.stringToSha256(hex));
  }

  @Override
  public byte[] sha256() {
    return sha256.clone();
  }

  /**
   * @return the first 8 hexadecimal digits, for messages
   */
  public String str() {
    return toString().substring(0, 8);
  }

  // NOTE: Arrays use reference equality, so we need our own equals() and hashCode()

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ObjectId other && Arrays.equals(sha256, other.sha256);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(sha256);
  }

  @Override
  public String toString() {
    return Util.sha256toString(sha256);
  }

}
