package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of structural edits.
 */
public class ChartEditsTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  /**
   * Root(n1){A(n2){A1(n3)}, B(n4), Check(n5)}, Other(n6), proxy n7 of A at the top level.
   */
  private static Chart sampleChart() throws StatechartException {
    final List<ChartNode> nodes = new ArrayList<>();
    final StateNode root = new StateNode("n1", "Root");
    root.setInitial("n2");
    nodes.add(root);
    final StateNode a = new StateNode("n2", "A", "n1");
    a.setInitial("n3");
    nodes.add(a);
    nodes.add(new StateNode("n3", "A1", "n2"));
    nodes.add(new StateNode("n4", "B", "n1"));
    nodes.add(new DecisionNode("n5", "Check", "n1"));
    nodes.add(new StateNode("n6", "Other"));
    final ProxyNode proxy = new ProxyNode("n7", "A", null, "n2");
    proxy.setTargetPath("Root/A");
    nodes.add(proxy);

    final List<Transition> edges = new ArrayList<>();
    edges.add(new Transition("e1", "n6", "n7"));
    edges.add(new Transition("e2", "n4", "n5"));
    edges.add(new Transition("e3", "n5", "n3"));
    edges.add(new Transition("e4", "n6", "n4"));
    final MachineProperties properties = new MachineProperties();
    properties.setInitial("n1");
    return new Chart(nodes, edges, false, properties);
  }

  private static List<String> ids(final List<? extends ChartNode> nodes) {
    final List<String> ids = new ArrayList<>();
    for (final ChartNode node : nodes) {
      ids.add(node.getId());
    }
    return ids;
  }

  @Test
  public void testCascadeDeleteTakesProxiesAndTheirEdges() throws StatechartException {
    final Chart chart = sampleChart();
    final Chart result = ChartEdits.cascadeDelete(chart, Collections.singleton("n2"));

    // 1. A, its child A1 and the proxy of A are gone
    assertEquals(Arrays.asList("n1", "n4", "n5", "n6"), ids(result.getNodes()));
    // 2. so are the edge into the proxy and the edge into A1
    assertEquals(2, result.getEdges().size());
    assertEquals("e2", result.getEdges().get(0).getId());
    assertEquals("e4", result.getEdges().get(1).getId());
    // 3. Root no longer names a removed initial
    assertNull(((StateNode) result.findNode("n1")).getInitial());
    assertTrue(ConsistencyChecker.check(result.getNodes(), result.getEdges()).isEmpty());

    // 4. the input snapshot is untouched
    assertEquals(7, chart.getNodes().size());
    assertEquals("n2", ((StateNode) chart.findNode("n1")).getInitial());
  }

  @Test
  public void testCascadeDeleteClearsRootInitial() throws StatechartException {
    final Chart chart = sampleChart();
    final Chart result = ChartEdits.cascadeDelete(chart, Collections.singleton("n1"));
    assertEquals(Arrays.asList("n6"), ids(result.getNodes()));
    assertTrue(result.getEdges().isEmpty());
    assertNull(result.getProperties().getInitial());
    assertEquals("n1", chart.getProperties().getInitial());
  }

  @Test
  public void testRename() throws StatechartException {
    final Chart renamed = ChartEdits.rename(sampleChart(), "n1", "Main");
    assertEquals("Main", renamed.findNode("n1").getLabel());
    assertEquals("Main/A", ((ProxyNode) renamed.findNode("n7")).getTargetPath());
  }

  @Test
  public void testRenameRejections() throws StatechartException {
    final Chart chart = sampleChart();
    for (final String label : Arrays.asList("", "  ", "a/b", "@x", ".", "..")) {
      try {
        ChartEdits.rename(chart, "n4", label);
        fail("Expected invalid label " + label);
      } catch (StatechartException problem) {
        assertEquals(Code.INVALID_LABEL, problem.getCode());
      }
    }
    try {
      ChartEdits.rename(chart, "n4", "Check");
      fail("Expected duplicate label");
    } catch (StatechartException problem) {
      assertEquals(Code.DUPLICATE_LABEL, problem.getCode());
    }
    try {
      ChartEdits.rename(chart, "ghost", "Fine");
      fail("Expected unknown node");
    } catch (StatechartException problem) {
      assertEquals(Code.UNKNOWN_NODE, problem.getCode());
    }
    // a top-level proxy shares its label with nothing that counts
    assertEquals("A", ChartEdits.rename(chart, "n6", "A").findNode("n6").getLabel());
  }

  @Test
  public void testDecisionNamesAreChartWide() throws StatechartException {
    // 1. a second decision in another scope
    final Chart chart = sampleChart();
    final List<ChartNode> nodes = new ArrayList<>(chart.getNodes());
    nodes.add(new DecisionNode("n8", "Route", "n6"));
    final Chart withTwo = new Chart(nodes, chart.getEdges(), false, chart.getProperties());

    // 2. it may not take the name of the decision under Root
    try {
      ChartEdits.rename(withTwo, "n8", "Check");
      fail("Expected duplicate decision name");
    } catch (StatechartException problem) {
      assertEquals(Code.DUPLICATE_LABEL, problem.getCode());
    }

    // 3. a state may still share a label with a decision elsewhere
    assertEquals("Check", ChartEdits.rename(withTwo, "n6", "Check").findNode("n6").getLabel());
    assertEquals("Gate", ChartEdits.rename(withTwo, "n8", "Gate").findNode("n8").getLabel());
  }

  @Test
  public void testMove() throws StatechartException {
    final Chart chart = sampleChart();
    final Chart moved = ChartEdits.move(chart, "n3", "n4");
    assertEquals("n4", moved.findNode("n3").getParentId());
    assertNull(((StateNode) moved.findNode("n2")).getInitial());
    assertEquals("Root/B/A1", ChartPaths.absolutePath("n3", moved));

    final Chart toTop = ChartEdits.move(chart, "n1", null);
    assertEquals("n1", toTop.getProperties().getInitial());

    final Chart rootMoved = ChartEdits.move(chart, "n1", "n6");
    assertNull(rootMoved.getProperties().getInitial());
    assertEquals("Other/Root/A", ((ProxyNode) rootMoved.findNode("n7")).getTargetPath());
  }

  @Test
  public void testMoveRejections() throws StatechartException {
    final Chart chart = sampleChart();
    for (final String parent : Arrays.asList("n1", "n2", "n3")) {
      try {
        ChartEdits.move(chart, "n1", parent);
        fail("Expected illegal move under " + parent);
      } catch (StatechartException problem) {
        assertEquals(Code.ILLEGAL_MOVE, problem.getCode());
      }
    }
    try {
      ChartEdits.move(chart, "n4", "n5");
      fail("Expected illegal move under a decision");
    } catch (StatechartException problem) {
      assertEquals(Code.ILLEGAL_MOVE, problem.getCode());
    }
    final Chart clash = ChartEdits.rename(chart, "n6", "B");
    try {
      ChartEdits.move(clash, "n6", "n1");
      fail("Expected duplicate label");
    } catch (StatechartException problem) {
      assertEquals(Code.DUPLICATE_LABEL, problem.getCode());
    }
  }

  @Test
  public void testTreeQueries() throws StatechartException {
    final List<ChartNode> nodes = sampleChart().getNodes();
    assertEquals(Arrays.asList("n2", "n4", "n5", "n3"), ids(ChartEdits.descendants("n1", nodes)));
    assertTrue(ChartEdits.descendants("ghost", nodes).isEmpty());
    assertTrue(ChartEdits.isAncestorOf("n1", "n3", nodes));
    assertFalse(ChartEdits.isAncestorOf("n3", "n1", nodes));
    assertFalse(ChartEdits.isAncestorOf("n6", "n3", nodes));
    assertEquals(0, ChartEdits.depth("n1", nodes));
    assertEquals(2, ChartEdits.depth("n3", nodes));
    assertEquals(0, ChartEdits.depth("ghost", nodes));
    assertEquals(2, ChartEdits.depth("n3", ChartPaths.index(nodes)));
  }

  @Test
  public void testUniqueLabel() throws StatechartException {
    final List<ChartNode> nodes = new ArrayList<>(sampleChart().getNodes());
    assertEquals("C", ChartEdits.uniqueLabel("C", "n1", nodes));
    assertEquals("B 2", ChartEdits.uniqueLabel("B", "n1", nodes));
    nodes.add(new StateNode("n8", "B 2", "n1"));
    assertEquals("B 3", ChartEdits.uniqueLabel("B", "n1", nodes));
    assertEquals("B", ChartEdits.uniqueLabel("B", null, nodes));
  }

  @Test
  public void testIdSequence() throws StatechartException {
    final IdSequence fresh = new IdSequence();
    assertEquals("node_1", fresh.nextId());
    assertEquals("node_2", fresh.nextId());

    final Chart loaded = ChartDeserializer.deserialize("states:\n  A: {}\n  B: {}\n", null);
    final List<ChartNode> nodes = new ArrayList<>(loaded.getNodes());
    nodes.add(new StateNode("custom_99", "C"));
    nodes.add(new StateNode("node_x", "D"));
    final IdSequence resumed = IdSequence.continuingAfter(nodes);
    assertEquals(3L, resumed.peek());
    assertEquals("node_3", resumed.nextId());
  }
}
