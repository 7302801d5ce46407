package edu.jhu.hlt.tb2ud.datatypes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;

/**
 * One sentence: a technical root whose descendants are the tokens, plus a
 * separate list of empty nodes which are not part of the tree (they only
 * take part in enhanced dependencies).
 *
 * @author travis
 */
public class DepTree {

  public static final Comparator<DepNode> BY_ORDINAL =
      (a, b) -> a.getOrdinal().compareTo(b.getOrdinal());

  private final String id;
  private final DepNode root;
  private final List<DepNode> emptyNodes;
  private final List<String> comments;

  public DepTree(String id) {
    this.id = id;
    this.root = new DepNode(this, Ordinal.ROOT, true, false);
    this.emptyNodes = new ArrayList<>();
    this.comments = new ArrayList<>();
  }

  public String getId() {
    return id;
  }

  public DepNode getRoot() {
    return root;
  }

  /** Lines of the sentence header, without the leading "#" */
  public List<String> getComments() {
    return comments;
  }

  /** Tokens (and not-yet-resolved artificial nodes) in document order */
  public List<DepNode> getDescendants() {
    return root.getDescendants();
  }

  /** Empty nodes in ordinal order. Do not modify. */
  public List<DepNode> getEmptyNodes() {
    return Collections.unmodifiableList(emptyNodes);
  }

  public int size() {
    return getDescendants().size();
  }

  /**
   * Adds a node at the given (integer) ordinal, attached to the root. Callers
   * are expected to call setParent afterwards.
   */
  public DepNode addNode(Ordinal ordinal) {
    if (ordinal.isRoot() || ordinal.isEmptyNode())
      throw new IllegalArgumentException("not a token ordinal: " + ordinal);
    DepNode n = new DepNode(this, ordinal, false, false);
    n.setParent(root);
    return n;
  }

  public DepNode addNode(int ordinal) {
    return addNode(Ordinal.of(ordinal));
  }

  /**
   * Adds an empty node at the given (fractional) ordinal, which must not be in
   * use already.
   */
  public DepNode createEmptyNode(Ordinal ordinal) {
    if (!ordinal.isEmptyNode())
      throw new IllegalArgumentException("not an empty node ordinal: " + ordinal);
    if (findEmptyNode(ordinal) != null)
      throw new IllegalArgumentException("empty node " + ordinal + " already exists in " + id);
    DepNode e = new DepNode(this, ordinal, false, true);
    emptyNodes.add(e);
    Collections.sort(emptyNodes, BY_ORDINAL);
    return e;
  }

  public DepNode findEmptyNode(Ordinal ordinal) {
    for (DepNode e : emptyNodes)
      if (e.getOrdinal().equals(ordinal))
        return e;
    return null;
  }

  /** A live tree node (root included) with exactly this ordinal, or null */
  public DepNode findNode(Ordinal ordinal) {
    if (ordinal.isRoot())
      return root;
    for (DepNode n : getDescendants())
      if (n.getOrdinal().equals(ordinal))
        return n;
    return null;
  }

  /**
   * After nodes have been removed, make token ordinals contiguous again
   * (1..n). Empty nodes keep following the token they came after and are
   * numbered 1..k within each slot in their current order.
   */
  public void renumber() {
    List<DepNode> tokens = getDescendants();
    // old word -> new word for every live token
    TreeMap<Integer, Integer> wordMap = new TreeMap<>();
    wordMap.put(0, 0);
    for (int i = 0; i < tokens.size(); i++)
      wordMap.put(tokens.get(i).getOrdinal().getWord(), i + 1);

    List<Ordinal> emptyOrds = new ArrayList<>();
    int prevWord = -1, slot = 0;
    for (DepNode e : emptyNodes) {
      int w = wordMap.floorEntry(e.getOrdinal().getWord()).getValue();
      slot = w == prevWord ? slot + 1 : 1;
      prevWord = w;
      emptyOrds.add(Ordinal.of(w).emptySlot(slot));
    }

    for (int i = 0; i < tokens.size(); i++)
      tokens.get(i).setOrdinal(Ordinal.of(i + 1));
    for (int i = 0; i < emptyNodes.size(); i++)
      emptyNodes.get(i).setOrdinal(emptyOrds.get(i));
  }

  /**
   * Throws an IllegalStateException unless every token has exactly one parent,
   * reaches the root, and is listed among its parent's children.
   */
  public void checkInvariants() {
    List<DepNode> nodes = getDescendants();
    Set<Ordinal> seen = new HashSet<>();
    for (DepNode n : nodes) {
      if (!seen.add(n.getOrdinal()))
        throw new IllegalStateException(id + ": two nodes at " + n.getOrdinal());
      DepNode p = n.getParent();
      if (p == null)
        throw new IllegalStateException(n.address() + " has no parent");
      if (!p.getChildren().contains(n))
        throw new IllegalStateException(n.address() + " is not a child of its parent " + p.address());
      int steps = 0;
      for (DepNode a = n; !a.isRoot(); a = a.getParent()) {
        if (a.getParent() == null || ++steps > nodes.size())
          throw new IllegalStateException(n.address() + " does not reach the root");
      }
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("<DepTree " + id);
    for (DepNode n : getDescendants())
      sb.append(' ').append(n.getOrdinal()).append(':').append(n.getForm())
        .append("->").append(n.getParent().getOrdinal()).append('/').append(n.getDeprel());
    for (DepNode e : emptyNodes)
      sb.append(' ').append(e.getOrdinal()).append(':').append(e.getForm());
    sb.append('>');
    return sb.toString();
  }
}
