package edu.jhu.hlt.tb2ud.construction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;

/**
 * Sorts non-leaf nodes by height, lowest first. Ties are broken by document
 * order. The technical root is never returned.
 *
 * @author travis
 */
public class BottomUpScheduler implements SubtreeScheduler {

  @Override
  public List<ScheduledSubtree> schedule(DepTree tree) {
    Map<DepNode, Integer> heights = new IdentityHashMap<>();
    height(tree.getRoot(), heights);
    List<ScheduledSubtree> subtrees = new ArrayList<>();
    for (DepNode n : tree.getDescendants()) {
      if (!n.isLeaf())
        subtrees.add(new ScheduledSubtree(n, heights.get(n)));
    }
    // stable, so document order is kept within a depth
    Collections.sort(subtrees, Comparator.comparingInt(ScheduledSubtree::getDepth));
    return subtrees;
  }

  private static int height(DepNode n, Map<DepNode, Integer> heights) {
    int h = 0;
    for (DepNode c : n.getChildren())
      h = Math.max(h, 1 + height(c, heights));
    heights.put(n, h);
    return h;
  }
}
