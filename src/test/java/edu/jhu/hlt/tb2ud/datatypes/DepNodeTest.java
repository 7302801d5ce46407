package edu.jhu.hlt.tb2ud.datatypes;

import static org.junit.Assert.*;

import org.junit.Test;

import edu.jhu.hlt.tb2ud.TestingUtil;
import edu.jhu.hlt.tb2ud.datatypes.DepNode.RemovalPolicy;

public class DepNodeTest {

  private DepTree chain() {
    // 1 <- 2 <- 3 <- root, 4 <- 3
    return TestingUtil.tree("chain",
        "1 a _ _ _ 2 x _",
        "2 b _ _ _ 3 x _",
        "3 c _ _ _ 0 root _",
        "4 d _ _ _ 3 x _");
  }

  @Test
  public void childrenStaySorted() {
    DepTree t = chain();
    DepNode three = TestingUtil.node(t, 3);
    TestingUtil.node(t, 1).setParent(three);
    assertEquals(3, three.getChildren().size());
    assertEquals(Ordinal.of(1), three.getChildren().get(0).getOrdinal());
    assertEquals(Ordinal.of(2), three.getChildren().get(1).getOrdinal());
    assertEquals(Ordinal.of(4), three.getChildren().get(2).getOrdinal());
    assertTrue(TestingUtil.node(t, 2).isLeaf());
  }

  @Test
  public void refusesCycles() {
    DepTree t = chain();
    String before = t.toString();
    DepNode three = TestingUtil.node(t, 3);
    try {
      three.setParent(TestingUtil.node(t, 1));
      fail("should not be able to attach a node below its own descendant");
    } catch (IllegalArgumentException e) {
      // expected
    }
    try {
      three.setParent(three);
      fail("should not be able to attach a node to itself");
    } catch (IllegalArgumentException e) {
      // expected
    }
    assertEquals(before, t.toString());
    t.checkInvariants();
  }

  @Test
  public void removeRehangs() {
    DepTree t = chain();
    DepNode two = TestingUtil.node(t, 2);
    two.remove(RemovalPolicy.REHANG);
    assertTrue(two.isRemoved());
    assertNull(two.getParent());
    assertEquals("3", TestingUtil.head(t, 1));
    assertEquals(3, t.size());
    assertNull(t.findNode(Ordinal.of(2)));
    t.checkInvariants();
  }

  @Test
  public void prevNodeAndPrecedes() {
    DepTree t = chain();
    assertTrue(TestingUtil.node(t, 1).getPrevNode().isRoot());
    assertEquals(Ordinal.of(2), TestingUtil.node(t, 3).getPrevNode().getOrdinal());
    assertTrue(TestingUtil.node(t, 1).precedes(TestingUtil.node(t, 4)));
    assertFalse(TestingUtil.node(t, 4).precedes(TestingUtil.node(t, 4)));
  }

  @Test
  public void descendants() {
    DepTree t = chain();
    assertEquals(3, TestingUtil.node(t, 3).getDescendants().size());
    assertEquals(1, TestingUtil.node(t, 2).getDescendants().size());
    assertTrue(TestingUtil.node(t, 1).isDescendantOf(TestingUtil.node(t, 3)));
    assertFalse(TestingUtil.node(t, 4).isDescendantOf(TestingUtil.node(t, 2)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyNodesAreNotInTheTree() {
    DepTree t = chain();
    DepNode e = t.createEmptyNode(Ordinal.parse("2.1"));
    TestingUtil.node(t, 1).setParent(e);
  }
}
