package edu.jhu.hlt.tb2ud.datatypes;

import static org.junit.Assert.*;

import org.junit.Test;

public class OrdinalTest {

  @Test
  public void parse() {
    assertEquals(Ordinal.ROOT, Ordinal.parse("0"));
    assertTrue(Ordinal.parse("0").isRoot());
    Ordinal o = Ordinal.parse("12.3");
    assertEquals(12, o.getWord());
    assertEquals(3, o.getEmpty());
    assertTrue(o.isEmptyNode());
    assertEquals("12.3", o.toString());
    assertEquals("7", Ordinal.parse("7").toString());
  }

  @Test(expected = IllegalArgumentException.class)
  public void parseGarbage() {
    Ordinal.parse("x.1");
  }

  @Test
  public void order() {
    assertTrue(Ordinal.parse("4").compareTo(Ordinal.parse("4.1")) < 0);
    assertTrue(Ordinal.parse("4.9").compareTo(Ordinal.parse("4.10")) < 0);
    assertTrue(Ordinal.parse("4.10").compareTo(Ordinal.parse("5")) < 0);
    assertEquals(0, Ordinal.parse("3.2").compareTo(new Ordinal(3, 2)));
  }

  @Test
  public void emptySlot() {
    assertEquals(Ordinal.parse("4.2"), Ordinal.of(4).emptySlot(2));
    assertEquals(Ordinal.parse("0.1"), Ordinal.ROOT.emptySlot(1));
  }
}
