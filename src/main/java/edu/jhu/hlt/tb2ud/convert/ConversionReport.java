package edu.jhu.hlt.tb2ud.convert;

import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;

import edu.jhu.hlt.tb2ud.construction.Construction;

/**
 * Counts of what happened while converting one or more sentences.
 *
 * @author travis
 */
public class ConversionReport {
  private int sentences;
  private int subtreesVisited;
  private int emptyNodesCreated;
  private int secondaryEdgesAdded;
  private int skippedEmptySlots;
  private final Multiset<Construction> rewritten = EnumMultiset.create(Construction.class);
  private final Multiset<ConversionProblem> problems = EnumMultiset.create(ConversionProblem.class);

  public void sentence() {
    sentences++;
  }

  public void visited() {
    subtreesVisited++;
  }

  public void rewrote(Construction c) {
    rewritten.add(c);
  }

  public void problem(ConversionProblem p) {
    problems.add(p);
  }

  public void emptyNodeCreated() {
    emptyNodesCreated++;
  }

  public void secondaryEdgeAdded() {
    secondaryEdgesAdded++;
  }

  /** An empty node ordinal was taken and the next slot was tried. Not a problem. */
  public void skippedEmptySlot() {
    skippedEmptySlots++;
  }

  public int getSentences() {
    return sentences;
  }

  public int getSubtreesVisited() {
    return subtreesVisited;
  }

  public int getEmptyNodesCreated() {
    return emptyNodesCreated;
  }

  public int getSecondaryEdgesAdded() {
    return secondaryEdgesAdded;
  }

  public int getSkippedEmptySlots() {
    return skippedEmptySlots;
  }

  public int count(Construction c) {
    return rewritten.count(c);
  }

  public int count(ConversionProblem p) {
    return problems.count(p);
  }

  @Override
  public String toString() {
    return "sentences=" + sentences
        + " subtrees=" + subtreesVisited
        + " rewritten=" + rewritten
        + " emptyNodes=" + emptyNodesCreated
        + " secondaryEdges=" + secondaryEdgesAdded
        + " problems=" + problems;
  }
}
