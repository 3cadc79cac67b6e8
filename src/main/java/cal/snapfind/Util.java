package cal.snapfind;

import cal.prim.QuietAutoCloseable;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public abstract class Util {

  /**
   * The suggested size of in-memory byte buffers for I/O.
   * The value is 8192, which is currently the size used by {@link BufferedInputStream}
   * on desktop JVMs.
   */
  public static final int SUGGESTED_BUFFER_SIZE = 8192;

  /**
   * A thread-local byte array of {@link #SUGGESTED_BUFFER_SIZE} bytes.
   */
  private static final ThreadLocal<byte[]> MEM_BUFFER = ThreadLocal.withInitial(() -> new byte[SUGGESTED_BUFFER_SIZE]);

  public static long copyStream(InputStream in, OutputStream out) throws IOException {
    byte[] buf = MEM_BUFFER.get();
    long count = 0;
    int n;
    while ((n = in.read(buf)) >= 0) {
      out.write(buf, 0, n);
      count += n;
    }
    return count;
  }

  public static byte[] read(InputStream in) throws IOException {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      copyStream(in, out);
      return out.toByteArray();
    }
  }

  public static MessageDigest sha256Digest() {
    MessageDigest md;
    try {
      md = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      // This should never happen; all JREs are required to support
      // SHA-256 (as well as MD5 and SHA-1).
      throw new UnsupportedOperationException();
    }
    return md;
  }

  public static byte[] sha256(byte[] data) {
    return sha256Digest().digest(data);
  }

  private static final String HEX_CHARS = "0123456789abcdef";
  public static String sha256toString(byte[] sha256) {
    StringBuilder builder = new StringBuilder();
    for (byte b : sha256) {
      int i = Byte.toUnsignedInt(b);
      builder.append(HEX_CHARS.charAt((i >> 4) & 0xF));
      builder.append(HEX_CHARS.charAt(i & 0xF));
    }
    return builder.toString();
  }

  /**
   * Convert a single hexadecimal digit to its integer value.
   * @param c a character
   * @return an int in the range [0, 15]
   */
  private static int hexValue(char c) {
    int value = Character.digit(c, 16);
    if (value < 0) {
      throw new IllegalArgumentException("character " + c + " is not a hex digit");
    }
    return value;
  }

  /**
   * Inverse of {@link #sha256toString(byte[])}.
   * @param sha256 64 hexadecimal digits
   * @return the 32 bytes they encode
   * @throws IllegalArgumentException if the string is not 64 hexadecimal digits
   */
  public static byte[] stringToSha256(CharSequence sha256) {
    int len = sha256.length();
    if (len != 64) {
      throw new IllegalArgumentException("string has the wrong length to be a SHA-256 sum (should be 64, was " + len + ')');
    }
    byte[] sum = new byte[32];
    for (int i = 0; i < sum.length; ++i) {
      char c1 = sha256.charAt(i * 2);
      char c2 = sha256.charAt(i * 2 + 1);
      int val1 = hexValue(c1);
      int val2 = hexValue(c2);
      sum[i] = (byte)(val1 << 4 | val2);
    }
    return sum;
  }

  /**
   * Join a directory path inside a snapshot with an entry name.  The root
   * directory is <code>"/"</code>, so <code>joinPath("/", "a")</code> is
   * <code>"/a"</code> and <code>joinPath("/a", "b")</code> is <code>"/a/b"</code>.
   */
  public static String joinPath(String prefix, String name) {
    return prefix.endsWith("/") ? prefix + name : prefix + '/' + name;
  }

  /**
   * Prevent the current thread from stopping during a JVM shutdown.
   * One common source of shutdowns is the Unix <code>SIGINT</code> signal that is
   * sent when a console user presses Ctrl+C.
   *
   * <p>The shutdown hook runs <code>onShutdown</code> and then waits for the current
   * thread to finish.  A typical <code>onShutdown</code> interrupts the current thread
   * so that it can abandon its work and release what it holds (such as a repository
   * lock) on its normal exit path.
   *
   * <p>The current thread must not call {@link System#exit(int)} after a shutdown has
   * begun: the hook waits for it, so the two would wait for each other forever.
   *
   * @param onShutdown a hook that is run when a shutdown would have occurred
   * @return an object whose {@link QuietAutoCloseable#close() close method} re-enables normal shutdown
   */
  public static QuietAutoCloseable catchShutdown(Runnable onShutdown) {
    // Source of this trick:
    // https://stackoverflow.com/a/2922031/784284

    final var unstoppableThread = Thread.currentThread();
    final var runtime = Runtime.getRuntime();
    final var shutdownHook = new Thread(() -> {
      onShutdown.run();
      for (;;) {
        try {
          unstoppableThread.join();
          return;
        } catch (InterruptedException ignored) {
          System.err.println("Ignoring interrupt...");
        }
      }
    });

    runtime.addShutdownHook(shutdownHook);
    return () -> {
      try {
        runtime.removeShutdownHook(shutdownHook);
      } catch (IllegalStateException ignored) {
        // This happens if the JVM is shutting down, in which case our hook
        // is already committed to running and removing it won't matter.
      }
    };
  }

}
