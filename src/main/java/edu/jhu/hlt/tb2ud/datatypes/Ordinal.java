package edu.jhu.hlt.tb2ud.datatypes;

import java.io.Serializable;

/**
 * Position of a node in a sentence. Tokens have integer ordinals (empty == 0),
 * the root is 0, and empty nodes are numbered word.empty (e.g. 4.1, 4.2) where
 * word is the token they follow.
 *
 * Note that 4.10 comes after 4.9; these are not decimals.
 *
 * @author travis
 */
public final class Ordinal implements Comparable<Ordinal>, Serializable {
  private static final long serialVersionUID = 6721395720131497102L;

  public static final Ordinal ROOT = new Ordinal(0, 0);

  private final int word;
  private final int empty;

  public Ordinal(int word, int empty) {
    if (word < 0 || empty < 0)
      throw new IllegalArgumentException("word=" + word + " empty=" + empty);
    this.word = word;
    this.empty = empty;
  }

  public static Ordinal of(int word) {
    return word == 0 ? ROOT : new Ordinal(word, 0);
  }

  /** Parses "7" or "7.2" */
  public static Ordinal parse(String s) {
    int dot = s.indexOf('.');
    try {
      if (dot < 0)
        return of(Integer.parseInt(s));
      return new Ordinal(
          Integer.parseInt(s.substring(0, dot)),
          Integer.parseInt(s.substring(dot + 1)));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not an ordinal: \"" + s + "\"", e);
    }
  }

  public int getWord() {
    return word;
  }

  public int getEmpty() {
    return empty;
  }

  public boolean isEmptyNode() {
    return empty > 0;
  }

  public boolean isRoot() {
    return word == 0 && empty == 0;
  }

  /** The n-th empty slot after this ordinal's word, e.g. 4 => 4.n */
  public Ordinal emptySlot(int n) {
    if (n < 1)
      throw new IllegalArgumentException("n=" + n);
    return new Ordinal(word, n);
  }

  @Override
  public int compareTo(Ordinal o) {
    if (word != o.word)
      return Integer.compare(word, o.word);
    return Integer.compare(empty, o.empty);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof Ordinal) {
      Ordinal o = (Ordinal) other;
      return word == o.word && empty == o.empty;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return word * 83 + empty;
  }

  @Override
  public String toString() {
    if (empty == 0)
      return String.valueOf(word);
    return word + "." + empty;
  }
}
