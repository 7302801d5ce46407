package edu.jhu.hlt.tb2ud.datatypes;

/**
 * Whether a node is a real token or scaffolding inserted by the upstream
 * conversion to stand in for an elided element.
 */
public enum NodeKind {
  ORDINARY,
  ARTIFICIAL;

  /** Value of the NodeType misc entry, null for ordinary nodes */
  public String miscValue() {
    return this == ARTIFICIAL ? "Artificial" : null;
  }

  public static NodeKind fromMiscValue(String value) {
    if ("Artificial".equals(value))
      return ARTIFICIAL;
    return ORDINARY;
  }
}
