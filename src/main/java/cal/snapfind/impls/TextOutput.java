package cal.snapfind.impls;

import cal.snapfind.types.MatchSink;
import cal.snapfind.types.Node;
import cal.snapfind.types.ObjectId;
import cal.snapfind.types.Snapshot;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.PrintStream;

/**
 * Human-readable output: one line per match, with a header before the
 * matches of each snapshot.
 *
 * <pre>
 * Found matching entries in snapshot 5d4c...
 * /home/user/a.txt
 * /home/user/sub/b.txt
 *
 * Found matching entries in snapshot 9a1f...
 * /home/user/sub/b.txt
 * </pre>
 */
public class TextOutput implements MatchSink {

  private final PrintStream out;
  private final @Nullable PrintStream messages;
  private final NodeFormatter formatter;

  private @Nullable ObjectId currentSnapshot = null;

  /**
   * @param out where matches go
   * @param messages where snapshot headers go, or null to leave them out
   * @param formatter renders each match
   */
  public TextOutput(PrintStream out, @Nullable PrintStream messages, NodeFormatter formatter) {
    this.out = out;
    this.messages = messages;
    this.formatter = formatter;
  }

  @Override
  public void emit(String prefix, Node node, Snapshot snapshot) {
    if (!snapshot.id().equals(currentSnapshot)) {
      if (messages != null) {
        if (currentSnapshot != null) {
          messages.println();
        }
        messages.println("Found matching entries in snapshot " + snapshot.id());
        messages.flush();
      }
      currentSnapshot = snapshot.id();
    }
    out.println(formatter.format(prefix, node));
    out.flush();
  }

  @Override
  public void finish() {
    out.flush();
  }

}
