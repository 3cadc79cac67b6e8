package cal.prim;

/**
 * Stored data could be read, but does not have the expected shape: it is not
 * legal JSON, a required field is missing, or its content does not hash to the
 * identifier it was stored under.
 */
public class MalformedDataException extends Exception {
  public MalformedDataException(String message) {
    super(message);
  }

  public MalformedDataException(String message, Throwable cause) {
    super(message, cause);
  }
}
