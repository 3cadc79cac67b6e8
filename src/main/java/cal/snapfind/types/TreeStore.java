package cal.snapfind.types;

import cal.prim.MalformedDataException;

import java.io.IOException;

/**
 * Resolves tree ids to trees.  Implementations that do I/O should give up
 * with {@link java.io.InterruptedIOException} when the calling thread has been
 * interrupted.
 */
@FunctionalInterface
public interface TreeStore {

  /**
   * @throws java.nio.file.NoSuchFileException if no tree has the given id
   * @throws IOException if the tree could not be read
   * @throws MalformedDataException if the stored tree is corrupt
   */
  Tree loadTree(ObjectId id) throws IOException, MalformedDataException;

}
