package cal.snapfind.types;

import java.io.IOException;

/**
 * Receives search results as they are found.  All matches from one snapshot
 * arrive before any match from the next snapshot.
 */
public interface MatchSink {

  /**
   * Report one match.
   *
   * @param prefix the path of the directory that contains <code>node</code>
   * @param node the matching entry
   * @param snapshot the snapshot the entry was found in
   */
  void emit(String prefix, Node node, Snapshot snapshot) throws IOException;

  /**
   * Called once after the last match.  The sink may not be used afterwards.
   */
  void finish() throws IOException;

}
