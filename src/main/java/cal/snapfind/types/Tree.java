package cal.snapfind.types;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A directory: an ordered list of entries.
 */
public record Tree(List<Node> nodes) {
  public Tree {
    nodes = ImmutableList.copyOf(nodes);
  }
}
