package edu.jhu.hlt.tb2ud.construction;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;

/**
 * Decides which construction a subtree (given by its root) is. Implementations
 * must not modify the tree and should only look at the subtree root and its
 * direct children. On well-formed input at most one predicate is true.
 *
 * @author travis
 */
public interface ConstructionClassifier {

  boolean isBridge(DepNode subtreeRoot);

  boolean isCoordination(DepNode subtreeRoot);

  boolean isApposition(DepNode subtreeRoot);

  boolean isCopula(DepNode subtreeRoot);

  boolean isEllipsis(DepNode subtreeRoot);

  /**
   * First matching construction, checked in the order bridge, coordination,
   * apposition, copula, ellipsis.
   */
  default Construction classify(DepNode subtreeRoot) {
    if (isBridge(subtreeRoot))
      return Construction.BRIDGE;
    if (isCoordination(subtreeRoot))
      return Construction.COORDINATION;
    if (isApposition(subtreeRoot))
      return Construction.APOSITION;
    if (isCopula(subtreeRoot))
      return Construction.COPULA;
    if (isEllipsis(subtreeRoot))
      return Construction.ELLIPSIS;
    return Construction.NONE;
  }
}
