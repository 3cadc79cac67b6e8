package cal.snapfind.repo;

/**
 * A snapshot id given by the user does not name exactly one snapshot.
 */
public class NoSuchSnapshotException extends Exception {
  public NoSuchSnapshotException(String message) {
    super(message);
  }
}
