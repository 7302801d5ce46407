package edu.jhu.hlt.tb2ud.convert;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.tb2ud.construction.AgldtConstructionClassifier;
import edu.jhu.hlt.tb2ud.construction.BottomUpScheduler;
import edu.jhu.hlt.tb2ud.construction.Construction;
import edu.jhu.hlt.tb2ud.construction.ConstructionClassifier;
import edu.jhu.hlt.tb2ud.construction.ScheduledSubtree;
import edu.jhu.hlt.tb2ud.construction.SubtreeScheduler;
import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.DepNode.RemovalPolicy;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.datatypes.UdRelations;

/**
 * Converts AGLDT-style trees to UD by re-drawing the subtrees whose shape
 * differs between the two schemes (relators, coordination, apposition,
 * copula, ellipsis). Labels are expected to have been converted already by
 * the shallow conversion, with the AGLDT label kept as the original deprel.
 *
 * Works bottom-up: subtrees are ordered by height once, before anything
 * changes, and rewritten lowest first. So when a preposition governing two
 * coordinated nouns is reached, the coordination below it has already been
 * turned into UD shape and the conjunct heading it is what gets promoted.
 *
 * Every rule checks its preconditions before touching the tree. If they don't
 * hold, the problem is logged, counted in the {@link ConversionReport}, and
 * the subtree is left as it was.
 *
 * @author travis
 */
public class SubtreeConverter {
  public static final Logger LOG = Logger.getLogger(SubtreeConverter.class);

  /** First letter of AGLDT positional tags that can head a relator's argument */
  public static final Set<Character> CONTENT_XPOS = ImmutableSet.of(
      'a', 'p', 'v', 'n', 't', 'l', 'm');

  /** Original labels of a relator's satellites, which are never promoted */
  public static final Set<String> RELATOR_SATELLITES = ImmutableSet.of(
      UdRelations.AGLDT_AUXY, UdRelations.AGLDT_AUXZ);

  private final boolean withEnhanced;
  private final ConstructionClassifier classifier;
  private final SubtreeScheduler scheduler;
  private final ArtificialNodeResolver resolver;

  public SubtreeConverter(boolean withEnhanced) {
    this(withEnhanced, new AgldtConstructionClassifier(), new BottomUpScheduler());
  }

  /**
   * @param withEnhanced if true, artificial nodes which survive rewriting are
   * turned into empty nodes and their dependencies kept as enhanced edges.
   * Otherwise they stay in the tree.
   */
  public SubtreeConverter(
      boolean withEnhanced,
      ConstructionClassifier classifier,
      SubtreeScheduler scheduler) {
    this.withEnhanced = withEnhanced;
    this.classifier = classifier;
    this.scheduler = scheduler;
    this.resolver = new ArtificialNodeResolver();
  }

  public boolean isWithEnhanced() {
    return withEnhanced;
  }

  public ConversionReport process(DepTree tree) {
    ConversionReport report = new ConversionReport();
    process(tree, report);
    return report;
  }

  /**
   * Rewrites the tree in place, adding counts to the given report.
   */
  public void process(DepTree tree, ConversionReport report) {
    report.sentence();
    List<ScheduledSubtree> subtrees = scheduler.schedule(tree);
    if (withEnhanced)
      resolver.recordStructure(tree);

    for (ScheduledSubtree st : subtrees) {
      DepNode subtree = st.getRoot();
      if (subtree.isRemoved()) {
        LOG.debug("[process] skipping removed node " + subtree.address());
        continue;
      }
      report.visited();
      Construction c = classifier.classify(subtree);
      boolean done;
      switch (c) {
      case BRIDGE:
        done = bridge(subtree, report);
        break;
      case COORDINATION:
        done = coordination(subtree, report);
        break;
      case APOSITION:
        done = apposition(subtree, report);
        break;
      case COPULA:
        done = copula(subtree, report);
        break;
      case ELLIPSIS:
        done = ellipsis(subtree, report);
        break;
      default:
        done = false;
        break;
      }
      if (done)
        report.rewrote(c);
    }

    if (withEnhanced)
      resolver.resolve(tree, report);
  }

  /**
   * Makes newHead take currentHead's place: newHead goes under currentHead's
   * parent with currentHead's label, currentHead goes under newHead, and
   * currentHead's other children move to newHead, except for goeswith
   * dependents which stay on the word they continue.
   */
  public static void promote(DepNode newHead, DepNode currentHead) {
    DepNode grand = currentHead.getParent();
    newHead.setDeprel(currentHead.getDeprel());
    newHead.setParent(grand);
    currentHead.setParent(newHead);

    // pass membership on to the new head, but don't clear it
    if (currentHead.isAposMember())
      newHead.setAposMember(true);
    if (currentHead.isCoordMember())
      newHead.setCoordMember(true);

    for (DepNode c : new ArrayList<>(currentHead.getChildren())) {
      if (!UdRelations.GOESWITH.equals(c.getUdeprel()))
        c.setParent(newHead);
    }
  }

  /**
   * Moves element under the first of its siblings to the right whose
   * universal deprel is label. Does nothing if there is no such sibling.
   */
  public static boolean attachRight(DepNode element, String label) {
    for (DepNode b : element.getParent().getChildren()) {
      if (b != element && !b.precedes(element) && label.equals(b.getUdeprel())) {
        element.setParent(b);
        return true;
      }
    }
    return false;
  }

  /**
   * Preposition or subordinating conjunction: its one content word (or
   * artificial node) becomes the head.
   */
  boolean bridge(DepNode subtree, ConversionReport report) {
    List<DepNode> candidates = new ArrayList<>();
    for (DepNode c : subtree.getChildren()) {
      if (c.isArtificial()
          || (isContentTag(c.getXpos()) && !RELATOR_SATELLITES.contains(c.getOriginalDeprel())))
        candidates.add(c);
    }
    if (candidates.size() != 1) {
      LOG.warn("[bridge] could not find a root candidate for " + subtree.address()
          + ", deprel=" + subtree.getDeprel() + ", candidates=" + candidates.size());
      report.problem(ConversionProblem.AMBIGUOUS_PROMOTION_CANDIDATE);
      return false;
    }
    promote(candidates.get(0), subtree);
    return true;
  }

  static boolean isContentTag(String xpos) {
    return xpos != null && !xpos.isEmpty() && CONTENT_XPOS.contains(xpos.charAt(0));
  }

  /**
   * The first conjunct becomes the head, the others hang off it as conj, and
   * coordinators and punctuation move to the conjunct on their right.
   */
  boolean coordination(DepNode subtree, ConversionReport report) {
    List<DepNode> members = members(subtree, true);
    if (members.isEmpty()) {
      LOG.error("[coordination] no coordination members for " + subtree.address());
      report.problem(ConversionProblem.MISSING_CONSTRUCTION_MEMBERS);
      return false;
    }
    DepNode first = members.get(0);
    first.setDeprel(subtree.getDeprel());
    first.setParent(subtree.getParent());
    for (DepNode m : members.subList(1, members.size())) {
      m.setParent(first);
      m.setDeprel(UdRelations.CONJ);
    }

    // the old head goes under the first conjunct before its remaining
    // children do, so that there is never a cycle
    subtree.setParent(first);
    for (DepNode c : new ArrayList<>(subtree.getChildren())) {
      c.setParent(first);
      // non-final coordinators
      if (UdRelations.AGLDT_AUXY.equals(c.getOriginalDeprel())
          && UdRelations.UPOS_CCONJ.equals(c.getUpos()))
        c.setDeprel(UdRelations.CC);
    }

    if (subtree.isArtificial())
      subtree.remove(RemovalPolicy.WARN);

    for (DepNode c : new ArrayList<>(first.getChildren())) {
      String u = c.getUdeprel();
      if ((UdRelations.CC.equals(u) || UdRelations.PUNCT.equals(u)) && !c.precedes(first))
        attachRight(c, UdRelations.CONJ);
    }
    return true;
  }

  /**
   * Like coordination, but the other members are labeled apos and nothing is
   * moved to the right.
   */
  boolean apposition(DepNode subtree, ConversionReport report) {
    List<DepNode> members = members(subtree, false);
    if (members.isEmpty()) {
      LOG.error("[apposition] no apposition members for " + subtree.address());
      report.problem(ConversionProblem.MISSING_CONSTRUCTION_MEMBERS);
      return false;
    }
    DepNode first = members.get(0);
    first.setDeprel(subtree.getDeprel());
    first.setParent(subtree.getParent());
    for (DepNode m : members.subList(1, members.size())) {
      m.setParent(first);
      m.setDeprel(UdRelations.APOS);
    }
    for (DepNode c : new ArrayList<>(subtree.getChildren()))
      c.setParent(first);

    if (subtree.isArtificial()) {
      subtree.remove(RemovalPolicy.WARN);
    } else {
      subtree.setParent(first);
      if (UdRelations.UPOS_PUNCT.equals(subtree.getUpos()))
        subtree.setDeprel(UdRelations.PUNCT);
    }
    return true;
  }

  private static List<DepNode> members(DepNode subtree, boolean coord) {
    List<DepNode> members = new ArrayList<>();
    for (DepNode c : subtree.getChildren()) {
      if (coord ? c.isCoordMember() : c.isAposMember())
        members.add(c);
    }
    return members;
  }

  /**
   * The predicate nominal becomes the head, the verb becomes its cop.
   */
  boolean copula(DepNode subtree, ConversionReport report) {
    DepNode pnom = null;
    int n = 0;
    for (DepNode c : subtree.getChildren()) {
      if (UdRelations.AGLDT_PNOM.equals(c.getOriginalDeprel())) {
        if (pnom == null)
          pnom = c;
        n++;
      }
    }
    if (pnom == null) {
      LOG.error("[copula] no PNOM for copula at " + subtree.address());
      report.problem(ConversionProblem.AMBIGUOUS_PROMOTION_CANDIDATE);
      return false;
    }
    if (n > 1)
      LOG.debug("[copula] " + n + " PNOMs under " + subtree.address() + ", using the first");

    promote(pnom, subtree);
    if (subtree.isArtificial()) {
      LOG.info("[copula] removing node " + subtree.address() + ", " + subtree.getOriginalDeprel());
      subtree.remove(RemovalPolicy.WARN);
    } else {
      // promote already put it under pnom
      subtree.setDeprel(UdRelations.COP);
    }
    return true;
  }

  /**
   * Elided head: its most core-like dependent is promoted into its place.
   */
  boolean ellipsis(DepNode subtree, ConversionReport report) {
    DepNode newHead = firstInPriority(subtree.getChildren(), UdRelations.ELLIPSIS_PROMOTION_ORDER);
    if (newHead == null) {
      LOG.error("[ellipsis] could not find candidates for promotion for "
          + subtree.address() + ", " + subtree.getForm());
      report.problem(ConversionProblem.AMBIGUOUS_PROMOTION_CANDIDATE);
      return false;
    }
    promote(newHead, subtree);
    return true;
  }

  /**
   * The first node (in document order) with the most preferred universal
   * deprel, or null if none of the nodes has one of the labels.
   */
  public static DepNode firstInPriority(List<DepNode> nodes, List<String> labels) {
    for (String l : labels) {
      for (DepNode n : nodes)
        if (l.equals(n.getUdeprel()))
          return n;
    }
    return null;
  }
}
