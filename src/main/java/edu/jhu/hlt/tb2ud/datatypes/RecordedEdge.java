package edu.jhu.hlt.tb2ud.datatypes;

/**
 * A (head-ordinal, relation) pair written down before rewriting starts, so
 * that enhanced edges to and from artificial nodes can be rebuilt after the
 * tree has been reshaped. Serialized as "head%:%relation" in the misc column.
 *
 * @author travis
 */
public final class RecordedEdge {
  public static final String SEPARATOR = "%:%";

  private final Ordinal head;
  private final String relation;

  public RecordedEdge(Ordinal head, String relation) {
    if (head == null)
      throw new IllegalArgumentException("no head");
    this.head = head;
    this.relation = relation;
  }

  public Ordinal getHead() {
    return head;
  }

  public String getRelation() {
    return relation;
  }

  public String serialize() {
    return head + SEPARATOR + relation;
  }

  public static RecordedEdge parse(String s) {
    int i = s.indexOf(SEPARATOR);
    if (i < 0)
      throw new IllegalArgumentException("missing " + SEPARATOR + " in \"" + s + "\"");
    return new RecordedEdge(
        Ordinal.parse(s.substring(0, i)),
        s.substring(i + SEPARATOR.length()));
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof RecordedEdge) {
      RecordedEdge e = (RecordedEdge) other;
      return head.equals(e.head)
          && (relation == null ? e.relation == null : relation.equals(e.relation));
    }
    return false;
  }

  @Override
  public int hashCode() {
    return head.hashCode() * 31 + (relation == null ? 0 : relation.hashCode());
  }

  @Override
  public String toString() {
    return serialize();
  }
}
