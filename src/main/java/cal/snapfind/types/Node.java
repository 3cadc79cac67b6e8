package cal.snapfind.types;

import com.google.common.collect.ImmutableList;
import lombok.Builder;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@link Tree}.  Directory entries carry the id of their
 * subtree; every other kind of entry has none.
 *
 * @param typeName the kind as it was stored; differs from <code>type</code> only for kinds
 *   this program does not know, which are {@link NodeType#OTHER}
 * @param mode POSIX permission bits, including the setuid, setgid and sticky bits
 * @param content ids of the data chunks of a regular file
 */
@Builder(toBuilder = true)
public record Node(
    String name,
    NodeType type,
    String typeName,
    int mode,
    Instant modTime,
    @Nullable Instant accessTime,
    @Nullable Instant changeTime,
    long uid,
    long gid,
    @Nullable String user,
    @Nullable String group,
    long inode,
    long deviceId,
    long size,
    long links,
    @Nullable String linkTarget,
    List<ExtendedAttribute> extendedAttributes,
    long device,
    List<ObjectId> content,
    @Nullable ObjectId subtree) {

  public record ExtendedAttribute(String name, String value) {
  }

  public Node {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(modTime, "modTime");
    if (type == null) {
      type = typeName != null ? NodeType.fromSerializedName(typeName) : NodeType.OTHER;
    }
    if (typeName == null) {
      typeName = type.serializedName();
    }
    if (name.isEmpty() || name.indexOf('/') >= 0 || name.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("illegal entry name \"" + name + '"');
    }
    if (type == NodeType.DIR && subtree == null) {
      throw new IllegalArgumentException("directory \"" + name + "\" has no subtree");
    }
    if (type != NodeType.DIR && subtree != null) {
      throw new IllegalArgumentException("entry \"" + name + "\" is not a directory but has a subtree");
    }
    extendedAttributes = extendedAttributes != null ? ImmutableList.copyOf(extendedAttributes) : ImmutableList.of();
    content = content != null ? ImmutableList.copyOf(content) : ImmutableList.of();
  }

  public boolean isDirectory() {
    return type == NodeType.DIR;
  }

}
