package edu.jhu.hlt.tb2ud.convert;

/**
 * Things that can go wrong while converting one sentence. None of them stop
 * the conversion: the subtree (or edge) in question is skipped.
 */
public enum ConversionProblem {
  /** bridge, copula, or ellipsis without exactly one node to promote */
  AMBIGUOUS_PROMOTION_CANDIDATE,
  /** coordination or apposition with no child flagged as a member */
  MISSING_CONSTRUCTION_MEMBERS,
  /** a recorded enhanced edge whose head no longer exists */
  UNRESOLVABLE_SECONDARY_EDGE,
}
