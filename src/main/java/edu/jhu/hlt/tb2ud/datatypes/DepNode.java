package edu.jhu.hlt.tb2ud.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * A node in a mutable dependency tree: a token, the technical root of a
 * sentence, or an empty node. Tree edges are parent/children pointers which
 * are only changed through {@link #setParent(DepNode)} and
 * {@link #remove(RemovalPolicy)}, both of which keep children sorted by
 * ordinal and refuse to create cycles.
 *
 * The AGLDT side information that the upstream shallow conversion leaves in
 * the misc column is held in typed fields (kind, original deprel, membership
 * flags, and the two working fields used for enhanced output). Any other misc
 * entries are kept verbatim in {@link #getMisc()}.
 *
 * @author travis
 */
public class DepNode {
  public static final Logger LOG = Logger.getLogger(DepNode.class);

  public enum RemovalPolicy {
    /** move children up to this node's parent */
    REHANG,
    /** like REHANG, but children are unexpected so complain about them */
    WARN,
  }

  private final DepTree tree;
  private final boolean root;
  private final boolean empty;
  private Ordinal ordinal;

  private String form;
  private String lemma;
  private String upos;
  private String xpos;
  private String feats;
  private String deprel;

  private DepNode parent;
  private final List<DepNode> children;
  private boolean removed = false;

  private NodeKind kind = NodeKind.ORDINARY;
  private String originalDeprel;
  private boolean coordMember;
  private boolean aposMember;
  private RecordedEdge recordedEdge;
  private Ordinal originalOrdinal;
  private final Map<String, String> misc;

  private final List<SecondaryEdge> deps;

  DepNode(DepTree tree, Ordinal ordinal, boolean root, boolean empty) {
    this.tree = tree;
    this.ordinal = ordinal;
    this.root = root;
    this.empty = empty;
    this.children = new ArrayList<>();
    this.misc = new LinkedHashMap<>();
    this.deps = new ArrayList<>();
  }

  public DepTree getTree() {
    return tree;
  }

  public boolean isRoot() {
    return root;
  }

  public boolean isEmpty() {
    return empty;
  }

  public boolean isRemoved() {
    return removed;
  }

  public Ordinal getOrdinal() {
    return ordinal;
  }

  void setOrdinal(Ordinal ordinal) {
    this.ordinal = ordinal;
  }

  public DepNode getParent() {
    return parent;
  }

  /** Children in document order. Do not modify. */
  public List<DepNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /** All nodes below this one, in document order */
  public List<DepNode> getDescendants() {
    List<DepNode> d = new ArrayList<>();
    addDescendants(this, d);
    Collections.sort(d, DepTree.BY_ORDINAL);
    return d;
  }

  private static void addDescendants(DepNode n, List<DepNode> addTo) {
    for (DepNode c : n.children) {
      addTo.add(c);
      addDescendants(c, addTo);
    }
  }

  public boolean isDescendantOf(DepNode ancestor) {
    for (DepNode p = parent; p != null; p = p.parent)
      if (p == ancestor)
        return true;
    return false;
  }

  public boolean precedes(DepNode other) {
    return ordinal.compareTo(other.ordinal) < 0;
  }

  /**
   * The closest node before this one in the tree (empty nodes not included),
   * or the root if this is the first token.
   */
  public DepNode getPrevNode() {
    DepNode prev = tree.getRoot();
    for (DepNode n : tree.getDescendants()) {
      if (!n.precedes(this))
        break;
      prev = n;
    }
    return prev;
  }

  /**
   * Re-attach this node under newParent. Throws an IllegalArgumentException
   * (without changing anything) if that would create a cycle.
   */
  public void setParent(DepNode newParent) {
    if (newParent == null)
      throw new IllegalArgumentException("use remove() to detach " + address());
    if (root || empty || newParent.empty)
      throw new IllegalArgumentException("can't attach " + address() + " to " + newParent.address());
    if (removed || newParent.removed)
      throw new IllegalStateException("removed node: " + address() + " -> " + newParent.address());
    if (newParent.tree != tree)
      throw new IllegalArgumentException("nodes belong to different trees");
    if (newParent == this || newParent.isDescendantOf(this)) {
      throw new IllegalArgumentException("attaching " + address()
          + " to " + newParent.address() + " would create a cycle");
    }
    if (parent == newParent)
      return;
    if (parent != null)
      parent.children.remove(this);
    parent = newParent;
    newParent.insertChild(this);
  }

  private void insertChild(DepNode c) {
    int i = Collections.binarySearch(children, c, DepTree.BY_ORDINAL);
    if (i >= 0)
      throw new IllegalStateException("two children at " + c.ordinal + " under " + address());
    children.add(-(i + 1), c);
  }

  /**
   * Deletes this node from the tree. Its children are moved up to its parent.
   */
  public void remove(RemovalPolicy policy) {
    if (root || empty)
      throw new IllegalArgumentException("can't remove " + address());
    if (removed)
      return;
    if (!children.isEmpty() && policy == RemovalPolicy.WARN) {
      LOG.warn("[remove] " + address() + " is being removed but has "
          + children.size() + " (unexpected) children, rehanging them");
    }
    for (DepNode c : new ArrayList<>(children))
      c.setParent(parent);
    parent.children.remove(this);
    parent = null;
    removed = true;
  }

  /** sentence id and ordinal, for log messages */
  public String address() {
    return tree.getId() + "#" + ordinal;
  }

  public String getForm() {
    return form;
  }

  public void setForm(String form) {
    this.form = form;
  }

  public String getLemma() {
    return lemma;
  }

  public void setLemma(String lemma) {
    this.lemma = lemma;
  }

  public String getUpos() {
    return upos;
  }

  public void setUpos(String upos) {
    this.upos = upos;
  }

  public String getXpos() {
    return xpos;
  }

  public void setXpos(String xpos) {
    this.xpos = xpos;
  }

  public String getFeats() {
    return feats;
  }

  public void setFeats(String feats) {
    this.feats = feats;
  }

  public String getDeprel() {
    return deprel;
  }

  public void setDeprel(String deprel) {
    this.deprel = deprel;
  }

  /** e.g. "obl" for "obl:tmod" */
  public String getUdeprel() {
    return UdRelations.universal(deprel);
  }

  public NodeKind getKind() {
    return kind;
  }

  public void setKind(NodeKind kind) {
    this.kind = kind;
  }

  public boolean isArtificial() {
    return kind == NodeKind.ARTIFICIAL;
  }

  /** AGLDT relation label this node had before the shallow conversion */
  public String getOriginalDeprel() {
    return originalDeprel;
  }

  public void setOriginalDeprel(String originalDeprel) {
    this.originalDeprel = originalDeprel;
  }

  public boolean isCoordMember() {
    return coordMember;
  }

  public void setCoordMember(boolean coordMember) {
    this.coordMember = coordMember;
  }

  public boolean isAposMember() {
    return aposMember;
  }

  public void setAposMember(boolean aposMember) {
    this.aposMember = aposMember;
  }

  public RecordedEdge getRecordedEdge() {
    return recordedEdge;
  }

  public void setRecordedEdge(RecordedEdge recordedEdge) {
    this.recordedEdge = recordedEdge;
  }

  public Ordinal getOriginalOrdinal() {
    return originalOrdinal;
  }

  public void setOriginalOrdinal(Ordinal originalOrdinal) {
    this.originalOrdinal = originalOrdinal;
  }

  /** Misc entries which don't have a typed field, in input order */
  public Map<String, String> getMisc() {
    return misc;
  }

  /** Enhanced (secondary) edges, in the order they were added */
  public List<SecondaryEdge> getDeps() {
    return Collections.unmodifiableList(deps);
  }

  public void addDep(DepNode governor, String relation) {
    if (governor.tree != tree)
      throw new IllegalArgumentException("nodes belong to different trees");
    deps.add(new SecondaryEdge(governor, relation));
  }

  @Override
  public String toString() {
    if (root)
      return "<ROOT " + tree.getId() + ">";
    return String.format("<DepNode %s %s %s->%s %s%s>",
        ordinal, form, deprel,
        parent == null ? "_" : parent.ordinal,
        kind == NodeKind.ARTIFICIAL ? "A" : "",
        empty ? "E" : "");
  }
}
