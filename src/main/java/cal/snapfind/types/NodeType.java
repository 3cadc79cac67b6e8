package cal.snapfind.types;

/**
 * The kind of a tree entry.
 */
public enum NodeType {
  FILE("file"),
  DIR("dir"),
  SYMLINK("symlink"),
  DEV("dev"),
  CHARDEV("chardev"),
  FIFO("fifo"),
  SOCKET("socket"),
  OTHER("other");

  private final String serializedName;

  NodeType(String serializedName) {
    this.serializedName = serializedName;
  }

  public String serializedName() {
    return serializedName;
  }

  /**
   * Inverse of {@link #serializedName()}.  Kinds this program does not know
   * about are {@link #OTHER}.
   */
  public static NodeType fromSerializedName(String name) {
    for (NodeType t : values()) {
      if (t.serializedName.equals(name)) {
        return t;
      }
    }
    return OTHER;
  }

  @Override
  public String toString() {
    return serializedName;
  }
}
