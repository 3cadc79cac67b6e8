package cal.prim;

import org.checkerframework.checker.mustcall.qual.InheritableMustCall;

/**
 * An <code>AutoCloseable</code> whose {@link #close()} method does not throw
 * any checked exceptions, so it can guard a <code>try</code> block without a
 * matching <code>catch</code>.
 */
@InheritableMustCall("close")
@FunctionalInterface
public interface QuietAutoCloseable extends AutoCloseable {
  @Override
  void close();
}
