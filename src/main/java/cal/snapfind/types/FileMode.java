package cal.snapfind.types;

/**
 * Rendering of entry permissions in the style <code>drwxr-xr-x</code>.
 *
 * <p>The leading letters name the kind of entry and the special bits:
 * <code>d</code> directory, <code>L</code> symbolic link, <code>D</code> device,
 * <code>p</code> named pipe, <code>S</code> socket, <code>u</code> setuid,
 * <code>g</code> setgid, <code>c</code> character device, <code>t</code> sticky.
 * A plain file with no special bits has a single <code>-</code>.
 */
public abstract class FileMode {

  public static final int SETUID = 04000;
  public static final int SETGID = 02000;
  public static final int STICKY = 01000;

  private static final String RWX = "rwxrwxrwx";

  public static String format(NodeType type, int mode) {
    StringBuilder b = new StringBuilder(12);
    if (type == NodeType.DIR) b.append('d');
    if (type == NodeType.SYMLINK) b.append('L');
    if (type == NodeType.DEV || type == NodeType.CHARDEV) b.append('D');
    if (type == NodeType.FIFO) b.append('p');
    if (type == NodeType.SOCKET) b.append('S');
    if ((mode & SETUID) != 0) b.append('u');
    if ((mode & SETGID) != 0) b.append('g');
    if (type == NodeType.CHARDEV) b.append('c');
    if ((mode & STICKY) != 0) b.append('t');
    if (b.length() == 0) {
      b.append('-');
    }
    for (int i = 0; i < RWX.length(); ++i) {
      boolean set = (mode & (1 << (RWX.length() - 1 - i))) != 0;
      b.append(set ? RWX.charAt(i) : '-');
    }
    return b.toString();
  }

}
