package edu.jhu.hlt.tb2ud.construction;

/**
 * The kinds of subtree whose shape differs between AGLDT and UD.
 */
public enum Construction {
  /** a relator (preposition, subordinator) heading its argument */
  BRIDGE,
  COORDINATION,
  APOSITION,
  COPULA,
  ELLIPSIS,
  /** none of the above, left alone */
  NONE,
}
