package edu.jhu.hlt.tb2ud.construction;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;

/**
 * A subtree root paired with its height (longest path down to a leaf).
 */
public final class ScheduledSubtree {
  private final DepNode root;
  private final int depth;

  public ScheduledSubtree(DepNode root, int depth) {
    this.root = root;
    this.depth = depth;
  }

  public DepNode getRoot() {
    return root;
  }

  public int getDepth() {
    return depth;
  }

  @Override
  public String toString() {
    return root.getOrdinal() + "@" + depth;
  }
}
