package cal.snapfind.impls;

import cal.snapfind.Util;
import cal.snapfind.types.FileMode;
import cal.snapfind.types.Node;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One-line rendering of a matched entry.
 */
public class NodeFormatter {

  private final boolean longListing;
  private final DateTimeFormatter timeFormat;

  public NodeFormatter(boolean longListing, ZoneId zone) {
    this.longListing = longListing;
    this.timeFormat = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ROOT).withZone(zone);
  }

  /**
   * Short form: the full path.  Long form, like <code>ls -l</code>:
   * <pre>
   *   -rw-r--r--  1000  1000   1234 2020-01-01 12:00:00 /home/user/a.txt
   * </pre>
   * Symbolic links also show their target.
   */
  public String format(String prefix, Node node) {
    String path = Util.joinPath(prefix, node.name());
    if (!longListing) {
      return path;
    }
    return switch (node.type()) {
      case FILE, DIR -> listing(node, path);
      case SYMLINK -> listing(node, path) + " -> " + node.linkTarget();
      default -> "<Node(" + node.typeName() + ") " + node.name() + '>';
    };
  }

  private String listing(Node node, String path) {
    return String.format(Locale.ROOT, "%s %5d %5d %6d %s %s",
        FileMode.format(node.type(), node.mode()),
        node.uid(),
        node.gid(),
        node.size(),
        timeFormat.format(node.modTime()),
        path);
  }

}
