package cal.snapfind.types;

/**
 * The search was asked for something that does not make sense: a malformed
 * pattern, an unparseable time, a wrong number of arguments.  Usage errors are
 * detected before any snapshot is searched.
 */
public class UsageException extends Exception {
  public UsageException(String message) {
    super(message);
  }

  public UsageException(String message, Throwable cause) {
    super(message, cause);
  }
}
