package edu.jhu.hlt.tb2ud.datatypes;

/**
 * An enhanced dependency: a (governor, relation) pair held by a node in
 * addition to its single tree parent. Not part of the tree.
 *
 * @author travis
 */
public class SecondaryEdge {
  private final DepNode governor;
  private final String relation;

  public SecondaryEdge(DepNode governor, String relation) {
    if (governor == null || relation == null)
      throw new IllegalArgumentException("governor=" + governor + " relation=" + relation);
    this.governor = governor;
    this.relation = relation;
  }

  public DepNode getGovernor() {
    return governor;
  }

  public String getRelation() {
    return relation;
  }

  @Override
  public String toString() {
    return governor.getOrdinal() + ":" + relation;
  }
}
