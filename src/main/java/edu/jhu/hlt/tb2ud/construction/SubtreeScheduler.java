package edu.jhu.hlt.tb2ud.construction;

import java.util.List;

import edu.jhu.hlt.tb2ud.datatypes.DepTree;

/**
 * Orders the subtrees of a sentence so that every subtree comes after all of
 * the subtrees nested inside it. Called once, before any rewriting.
 */
public interface SubtreeScheduler {

  /**
   * @return every non-leaf token in the tree, by non-decreasing depth
   */
  List<ScheduledSubtree> schedule(DepTree tree);
}
