package edu.jhu.hlt.tb2ud.construction;

import java.util.Collection;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.UdRelations;

/**
 * Recognizes constructions from the original AGLDT labels (AuxP, AuxC, COORD,
 * APOS, PNOM) and node kinds left in the misc column by the shallow
 * conversion.
 *
 * @author travis
 */
public class AgldtConstructionClassifier implements ConstructionClassifier {

  public static final Set<String> DEFAULT_COPULA_LEMMAS = ImmutableSet.of("εἰμί", "sum");

  private final Set<String> copulaLemmas;

  public AgldtConstructionClassifier() {
    this(DEFAULT_COPULA_LEMMAS);
  }

  public AgldtConstructionClassifier(Collection<String> copulaLemmas) {
    this.copulaLemmas = ImmutableSet.copyOf(copulaLemmas);
  }

  public Set<String> getCopulaLemmas() {
    return copulaLemmas;
  }

  @Override
  public boolean isBridge(DepNode n) {
    if (n.isLeaf())
      return false;
    String o = n.getOriginalDeprel();
    return UdRelations.AGLDT_AUXP.equals(o) || UdRelations.AGLDT_AUXC.equals(o);
  }

  @Override
  public boolean isCoordination(DepNode n) {
    return !n.isLeaf() && UdRelations.AGLDT_COORD.equals(n.getOriginalDeprel());
  }

  @Override
  public boolean isApposition(DepNode n) {
    return !n.isLeaf() && UdRelations.AGLDT_APOS.equals(n.getOriginalDeprel());
  }

  @Override
  public boolean isCopula(DepNode n) {
    if (n.isLeaf() || isBridge(n) || isCoordination(n) || isApposition(n))
      return false;
    if (!copulaLemmas.contains(n.getLemma()))
      return false;
    for (DepNode c : n.getChildren())
      if (UdRelations.AGLDT_PNOM.equals(c.getOriginalDeprel()))
        return true;
    return false;
  }

  @Override
  public boolean isEllipsis(DepNode n) {
    return !n.isLeaf()
        && n.isArtificial()
        && !isBridge(n)
        && !isCoordination(n)
        && !isApposition(n)
        && !isCopula(n);
  }
}
