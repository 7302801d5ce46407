package edu.jhu.hlt.tb2ud.io;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.NodeKind;
import edu.jhu.hlt.tb2ud.datatypes.Ordinal;
import edu.jhu.hlt.tb2ud.datatypes.RecordedEdge;

/**
 * Moves the AGLDT side information between the CoNLL-U misc column
 * ("NodeType=Artificial|original_dep=AuxP|CoordMember=True") and the typed
 * fields of a {@link DepNode}. Keys we don't know about are kept as they are.
 *
 * @author travis
 */
public class MiscCodec {

  public static final String NODE_TYPE = "NodeType";
  public static final String ORIGINAL_DEP = "original_dep";
  public static final String COORD_MEMBER = "CoordMember";
  public static final String APOS_MEMBER = "AposMember";
  public static final String ART_DEPS = "ArtDeps";
  public static final String ORIGINAL_ORD = "OriginalOrd";

  // older spellings
  public static final String ART_DEPS_ALT = "art_deps";
  public static final String ORIGINAL_ORD_ALT = "original_ord";

  private static final Splitter BAR = Splitter.on('|').omitEmptyStrings();
  private static final Joiner JOIN = Joiner.on('|');

  public static void decode(String misc, DepNode n) {
    if (misc == null || misc.equals("_"))
      return;
    for (String kv : BAR.split(misc)) {
      int eq = kv.indexOf('=');
      String k = eq < 0 ? kv : kv.substring(0, eq);
      String v = eq < 0 ? null : kv.substring(eq + 1);
      switch (k) {
      case NODE_TYPE:
        n.setKind(NodeKind.fromMiscValue(v));
        break;
      case ORIGINAL_DEP:
        n.setOriginalDeprel(v);
        break;
      case COORD_MEMBER:
        n.setCoordMember(parseBool(v));
        break;
      case APOS_MEMBER:
        n.setAposMember(parseBool(v));
        break;
      case ART_DEPS:
      case ART_DEPS_ALT:
        n.setRecordedEdge(RecordedEdge.parse(v));
        break;
      case ORIGINAL_ORD:
      case ORIGINAL_ORD_ALT:
        n.setOriginalOrdinal(Ordinal.parse(v));
        break;
      default:
        n.getMisc().put(k, v);
        break;
      }
    }
  }

  private static boolean parseBool(String v) {
    return v != null && v.equalsIgnoreCase("true");
  }

  public static String encode(DepNode n) {
    List<String> items = new ArrayList<>();
    if (n.getKind() == NodeKind.ARTIFICIAL)
      items.add(NODE_TYPE + "=" + n.getKind().miscValue());
    if (n.getOriginalDeprel() != null)
      items.add(ORIGINAL_DEP + "=" + n.getOriginalDeprel());
    if (n.isCoordMember())
      items.add(COORD_MEMBER + "=True");
    if (n.isAposMember())
      items.add(APOS_MEMBER + "=True");
    if (n.getRecordedEdge() != null)
      items.add(ART_DEPS + "=" + n.getRecordedEdge().serialize());
    if (n.getOriginalOrdinal() != null)
      items.add(ORIGINAL_ORD + "=" + n.getOriginalOrdinal());
    for (Map.Entry<String, String> e : n.getMisc().entrySet())
      items.add(e.getValue() == null ? e.getKey() : e.getKey() + "=" + e.getValue());
    return items.isEmpty() ? "_" : JOIN.join(items);
  }
}
