package edu.jhu.hlt.tb2ud.datatypes;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Relation labels (UD and AGLDT) that the converter reads or writes.
 *
 * @author travis
 */
public class UdRelations {

  // UD
  public static final String CONJ = "conj";
  public static final String CC = "cc";
  public static final String PUNCT = "punct";
  public static final String APOS = "apos";
  public static final String COP = "cop";
  public static final String GOESWITH = "goeswith";

  /**
   * Which dependent of an elided head gets promoted, most preferred first.
   */
  public static final List<String> ELLIPSIS_PROMOTION_ORDER = ImmutableList.of(
      "nsubj", "obj", "iobj", "obl", "advmod", "csubj", "xcomp", "ccomp",
      "advcl", "dislocated", "vocative", "nmod");

  // AGLDT
  public static final String AGLDT_AUXP = "AuxP";
  public static final String AGLDT_AUXC = "AuxC";
  public static final String AGLDT_AUXY = "AuxY";
  public static final String AGLDT_AUXZ = "AuxZ";
  public static final String AGLDT_COORD = "COORD";
  public static final String AGLDT_APOS = "APOS";
  public static final String AGLDT_PNOM = "PNOM";

  // UPOS
  public static final String UPOS_CCONJ = "CCONJ";
  public static final String UPOS_PUNCT = "PUNCT";

  /**
   * Universal part of a label, e.g. "obl" for "obl:tmod".
   */
  public static String universal(String deprel) {
    if (deprel == null)
      return null;
    int colon = deprel.indexOf(':');
    return colon < 0 ? deprel : deprel.substring(0, colon);
  }
}
