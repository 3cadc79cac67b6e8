package cal.prim.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.util.stream.Stream;

/**
 * An eventually consistent directory.  Often called an "object store", implementations of this
 * interface offer a map-like storage model that associates short string keys with byte arrays.
 * To avoid confusion with the Java term "Object", this interface has the name "directory"
 * instead of "object store".
 *
 * <p>A snapshot repository stores its trees and snapshots under their content hash, so those
 * entries are written once and never change; the weak guarantees below only matter for entries
 * that come and go, such as lock files.
 * <ul>
 *   <li>{@link #list()} includes every settled entry and may include any subset of the entries
 *       that are still being created or deleted.</li>
 *   <li>An entry seen by {@link #list()} may already be gone by the time it is
 *       {@link #open(String) opened}; callers see a {@link NoSuchFileException}.</li>
 * </ul>
 */
public interface EventuallyConsistentDirectory {

  /**
   * List the entries in the directory.  The returned list is not guaranteed to be in any
   * particular order.  It will never contain duplicates.
   *
   * @return a stream of entry names
   * @throws IOException if the external storage could not be reached
   */
  Stream<String> list() throws IOException;

  /**
   * Schedule the creation of an entry.
   *
   * @param name the name of the entry
   * @param stream the data to write
   * @throws IOException if the outcome of the scheduling cannot be determined, or if the
   *   given <code>stream</code> throws an <code>IOException</code> while reading
   */
  void createOrReplace(String name, InputStream stream) throws IOException;

  /**
   * Open an entry for reading.
   *
   * @param name the entry to read
   * @return an unbuffered stream to read from
   * @throws IOException if the stream cannot be opened
   * @throws NoSuchFileException if the entry does not exist
   */
  InputStream open(String name) throws IOException;

  /**
   * Schedule the deletion of an entry.
   *
   * @param name the name of the entry to delete
   * @throws IOException if the outcome of the scheduling cannot be determined
   */
  void delete(String name) throws IOException;

}
