package cal.prim.time;

import java.time.Instant;

/**
 * A wall clock can tell you the date and time.  Most ways of measuring wall
 * clock time (such as Java's <code>Instant.now()</code>) are unreliable: a
 * computer's notion of wall clock time can be wrong, and two computers sharing
 * one repository may disagree about it.
 *
 * <p>Repository locks are timestamped with this clock, and other processes
 * decide from those timestamps whether a lock is stale.  Tests substitute a
 * fixed clock.
 */
@FunctionalInterface
public interface UnreliableWallClock {
  Instant now();

  UnreliableWallClock SYSTEM_CLOCK = Instant::now;

  static UnreliableWallClock fixed(Instant instant) {
    return () -> instant;
  }
}
