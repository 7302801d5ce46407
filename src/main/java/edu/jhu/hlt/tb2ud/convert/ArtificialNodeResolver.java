package edu.jhu.hlt.tb2ud.convert;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.DepNode.RemovalPolicy;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.datatypes.Ordinal;
import edu.jhu.hlt.tb2ud.datatypes.RecordedEdge;

/**
 * Turns artificial nodes that are still in the tree after rewriting into
 * empty nodes, and rebuilds the dependencies to and from them as enhanced
 * edges.
 *
 * Rewriting destroys the edges around artificial nodes, so
 * {@link #recordStructure(DepTree)} has to run on the original tree and
 * {@link #resolve(DepTree, ConversionReport)} after all subtrees are done.
 * Heads are looked up by the ordinals they had before rewriting; nothing is
 * renumbered in between.
 *
 * @author travis
 */
public class ArtificialNodeResolver {
  public static final Logger LOG = Logger.getLogger(ArtificialNodeResolver.class);

  /**
   * Writes down (parent ordinal, deprel) for every artificial node and every
   * node hanging off an artificial node, and stamps artificial nodes with
   * their current ordinal.
   */
  public void recordStructure(DepTree tree) {
    for (DepNode n : tree.getDescendants()) {
      if (n.isArtificial() || n.getParent().isArtificial())
        n.setRecordedEdge(new RecordedEdge(n.getParent().getOrdinal(), n.getDeprel()));
      if (n.isArtificial())
        n.setOriginalOrdinal(n.getOrdinal());
    }
  }

  /**
   * Drops what {@link #recordStructure(DepTree)} wrote down. Those ordinals
   * refer to the numbering before conversion, so this has to happen before
   * the tree is renumbered.
   */
  public static void clearRecordedStructure(DepTree tree) {
    List<DepNode> nodes = new ArrayList<>(tree.getDescendants());
    nodes.addAll(tree.getEmptyNodes());
    for (DepNode n : nodes) {
      n.setRecordedEdge(null);
      n.setOriginalOrdinal(null);
    }
  }

  /**
   * Replaces remaining artificial nodes with empty nodes and adds enhanced
   * edges for what was recorded. Edges whose head can't be found are logged
   * and dropped.
   */
  public void resolve(DepTree tree, ConversionReport report) {
    List<DepNode> arts = new ArrayList<>();
    for (DepNode n : tree.getDescendants())
      if (n.isArtificial())
        arts.add(n);
    if (arts.isEmpty())
      return;

    // original ordinal of the artificial node => empty node replacing it
    Map<Ordinal, DepNode> artMapping = new HashMap<>();
    List<DepNode> created = new ArrayList<>();
    for (DepNode art : arts) {
      DepNode e = copyToEmpty(art, tree, report);
      artMapping.put(e.getOriginalOrdinal(), e);
      created.add(e);
    }

    for (DepNode e : created) {
      RecordedEdge r = e.getRecordedEdge();
      if (r == null) {
        LOG.error("[resolve] nothing recorded for the deps of " + e.address());
        report.problem(ConversionProblem.UNRESOLVABLE_SECONDARY_EDGE);
        continue;
      }
      DepNode head = resolveHead(r.getHead(), tree, artMapping);
      if (head == null) {
        LOG.warn("[resolve] dropping enhanced edge " + e.address() + " -> " + r
            + ", head no longer exists");
        report.problem(ConversionProblem.UNRESOLVABLE_SECONDARY_EDGE);
        continue;
      }
      if (head.isRoot())
        LOG.debug("[resolve] setting deps root to 0 for " + e.getForm() + " in " + tree.getId());
      e.addDep(head, r.getRelation());
      report.secondaryEdgeAdded();
    }

    // Often the tree already has an edge saying the same thing (e.g. when the
    // artificial head was deleted), so failures here are expected.
    for (DepNode n : tree.getDescendants()) {
      RecordedEdge r = n.getRecordedEdge();
      if (r == null)
        continue;
      DepNode head = resolveHead(r.getHead(), tree, artMapping);
      if (head == null) {
        LOG.debug("[resolve] skipping enhanced edge " + n.address() + " -> " + r);
        report.problem(ConversionProblem.UNRESOLVABLE_SECONDARY_EDGE);
        continue;
      }
      n.addDep(head, r.getRelation());
      report.secondaryEdgeAdded();
    }
  }

  /**
   * Root for 0, the empty node that replaced an artificial node, or the live
   * token at exactly that ordinal. Null if none of them.
   */
  static DepNode resolveHead(Ordinal head, DepTree tree, Map<Ordinal, DepNode> artMapping) {
    DepNode e = artMapping.get(head);
    if (e != null)
      return e;
    return tree.findNode(head);
  }

  /**
   * Makes an empty node out of art, right after the token preceding it, and
   * deletes art from the tree (its children are moved to its parent).
   */
  DepNode copyToEmpty(DepNode art, DepTree tree, ConversionReport report) {
    Ordinal ord = nextEmptyOrdinal(art, tree, report);
    DepNode empty = tree.createEmptyNode(ord);
    empty.setForm("E" + ord);
    empty.setLemma(art.getLemma());
    empty.setUpos(art.getUpos());
    empty.setXpos(art.getXpos());
    empty.setFeats(art.getFeats());
    empty.setDeprel(art.getDeprel());
    empty.setOriginalDeprel(art.getOriginalDeprel());
    empty.setAposMember(art.isAposMember());
    empty.setCoordMember(art.isCoordMember());
    empty.setRecordedEdge(art.getRecordedEdge());
    empty.setOriginalOrdinal(art.getOriginalOrdinal() != null
        ? art.getOriginalOrdinal() : art.getOrdinal());
    LOG.debug("[copyToEmpty] creating empty node " + empty.address() + " for " + art.address());
    report.emptyNodeCreated();

    // its children may include artificial nodes which haven't been copied yet
    art.remove(RemovalPolicy.REHANG);
    return empty;
  }

  /**
   * prev.1, prev.2, ... where prev is the token before art; the first one not
   * used by an empty node yet.
   */
  static Ordinal nextEmptyOrdinal(DepNode art, DepTree tree, ConversionReport report) {
    Ordinal prev = art.getPrevNode().getOrdinal();
    for (int i = 1; ; i++) {
      Ordinal o = Ordinal.of(prev.getWord()).emptySlot(i);
      if (tree.findEmptyNode(o) == null)
        return o;
      LOG.debug("[nextEmptyOrdinal] " + o + " is taken in " + tree.getId());
      report.skippedEmptySlot();
    }
  }
}
