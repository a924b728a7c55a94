package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.HashMap;
import java.util.Map;

import org.junit.Test;

import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity and correctness of the document to model direction.
 */
public class ChartDeserializerTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final double DELTA = 1e-9;

  private static Map<String, ChartNode> byPath(final Chart chart) {
    final Map<String, ChartNode> nodes = new HashMap<>();
    for (final Map.Entry<String, String> entry : ChartPaths.pathsById(chart.getNodes())
        .entrySet()) {
      nodes.put(entry.getValue(), chart.findNode(entry.getKey()));
    }
    return nodes;
  }

  @Test
  public void testForwardReferencesAndIds() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    initial: Idle\n"
        + "    states:\n"
        + "      Idle:\n"
        + "        transitions:\n"
        + "          - to: Running\n"
        + "            guard: go\n"
        + "      Running:\n"
        + "        entry: start();\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);

    // 1. ids are minted in document order, parents first
    assertEquals(3, chart.getNodes().size());
    assertEquals("node_1", chart.getNodes().get(0).getId());
    assertEquals("Root", chart.getNodes().get(0).getLabel());
    assertEquals("node_2", chart.getNodes().get(1).getId());
    assertEquals("node_3", chart.getNodes().get(2).getId());

    // 2. a transition to a state declared later still resolves
    assertEquals(1, chart.getEdges().size());
    final Transition edge = chart.getEdges().get(0);
    assertEquals("enode_2-node_3-0", edge.getId());
    assertEquals("node_2", edge.getSourceId());
    assertEquals("node_3", edge.getTargetId());
    assertEquals("go", edge.getGuard());

    // 3. initial resolves among the children
    final StateNode root = (StateNode) chart.getNodes().get(0);
    assertEquals("node_2", root.getInitial());
    assertEquals("start();", ((StateNode) chart.getNodes().get(2)).getEntry());
  }

  @Test
  public void testAutoLayout() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    states:\n"
        + "      Idle:\n"
        + "      Running: {}\n"
        + "  Other: {}\n";
    final Map<String, ChartNode> nodes = byPath(ChartDeserializer.deserialize(text, null));

    assertEquals(Bounds.of(50, 50, 410, 110), nodes.get("Root").getBounds());
    assertEquals(Bounds.of(20, 40, 150, 50), nodes.get("Root/Idle").getBounds());
    assertEquals(Bounds.of(220, 40, 150, 50), nodes.get("Root/Running").getBounds());
    assertEquals(Bounds.of(510, 50, 150, 50), nodes.get("Other").getBounds());
  }

  @Test
  public void testAutoLayoutEnclosesDecisions() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    decisions:\n"
        + "      Check: []\n";
    final Map<String, ChartNode> nodes = byPath(ChartDeserializer.deserialize(text, null));
    assertEquals(Bounds.square(20, 40, 15), nodes.get("Root/Check").getBounds());
    // 20 + 15 + 40 is narrower than the default
    assertEquals(Bounds.of(50, 50, 150, 75), nodes.get("Root").getBounds());
  }

  @Test
  public void testSavedGeometryWins() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    graphics: {x: 5, y: 6.5, width: 300, height: 200, showEntry: true}\n"
        + "    states:\n"
        + "      Idle:\n"
        + "        graphics: {x: 30, y: 60, width: 100, height: 40}\n";
    final Map<String, ChartNode> nodes = byPath(ChartDeserializer.deserialize(text, null));
    assertEquals(Bounds.of(5, 6.5, 300, 200), nodes.get("Root").getBounds());
    assertTrue(((StateNode) nodes.get("Root")).isShowEntry());
    assertEquals(Bounds.of(30, 60, 100, 40), nodes.get("Root/Idle").getBounds());
  }

  @Test
  public void testCustomLayout() throws StatechartException {
    final LayoutConfiguration layout = LayoutConfiguration.LayoutConfigurationBuilder.newBuilder()
        .topLevelOrigin(Point.of(0, 0)).defaultStateSize(100, 30).horizontalGap(10).build();
    final Chart chart = ChartDeserializer.deserialize("states:\n  A: {}\n  B: {}\n", layout);
    final Map<String, ChartNode> nodes = byPath(chart);
    assertEquals(Bounds.of(0, 0, 100, 30), nodes.get("A").getBounds());
    assertEquals(Bounds.of(110, 0, 100, 30), nodes.get("B").getBounds());
  }

  @Test
  public void testHistoryMarkers() throws StatechartException {
    final String text = "history: true\n"
        + "states:\n"
        + "  Root:\n"
        + "    history: true\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    assertTrue(chart.isRootHistory());
    assertEquals(Marker.of(Point.of(20, 20), 20), chart.getProperties().getHistoryMarker());

    final StateNode root = (StateNode) chart.getNodes().get(0);
    assertTrue(root.isHistory());
    final Marker marker = root.getHistoryMarker();
    assertEquals(7.5, marker.getPosition().getX(), DELTA);
    assertEquals(2.5, marker.getPosition().getY(), DELTA);
    assertEquals(7.5, marker.getSize(), DELTA);
  }

  @Test
  public void testUnresolvedReferencesAreDropped() throws StatechartException {
    final String text = "initial: Nowhere\n"
        + "states:\n"
        + "  A:\n"
        + "    initial: Missing\n"
        + "    transitions:\n"
        + "      - to: Ghost\n"
        + "      - to: '@NoSuchDecision'\n"
        + "      - guard: no target\n"
        + "      - B\n"
        + "  B: {}\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    assertEquals(2, chart.getNodes().size());
    assertTrue(chart.getEdges().isEmpty());
    assertNull(((StateNode) chart.getNodes().get(0)).getInitial());
    assertNull(chart.getProperties().getInitial());
    assertTrue(ConsistencyChecker.check(chart.getNodes(), chart.getEdges()).isEmpty());
  }

  @Test
  public void testInitialMustBeDirectChild() throws StatechartException {
    final String text = "states:\n"
        + "  A:\n"
        + "    initial: B\n"
        + "  B: {}\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    assertNull(((StateNode) chart.getNodes().get(0)).getInitial());
  }

  @Test
  public void testRootInitialMustBeTopLevel() throws StatechartException {
    final String text = "initial: Root/Idle\n"
        + "states:\n"
        + "  Root:\n"
        + "    states:\n"
        + "      Idle: {}\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    assertEquals(2, chart.getNodes().size());
    assertNull(chart.getProperties().getInitial());

    // what loads is what saves
    final Chart reloaded =
        ChartDeserializer.deserialize(ChartSerializer.serialize(chart, false), null);
    assertNull(reloaded.getProperties().getInitial());
  }

  @Test
  public void testBothDecisionForms() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    decisions:\n"
        + "      Bare:\n"
        + "        - to: ./Idle\n"
        + "          guard: x > 0\n"
        + "      Drawn:\n"
        + "        transitions:\n"
        + "          - to: ./Idle\n"
        + "        graphics: {x: 200, y: 10, size: 20}\n"
        + "    states:\n"
        + "      Idle:\n"
        + "        transitions:\n"
        + "          - to: '@Bare'\n"
        + "          - to: '@Drawn'\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    final Map<String, ChartNode> nodes = byPath(chart);
    final ChartNode bare = nodes.get("Root/Bare");
    final ChartNode drawn = nodes.get("Root/Drawn");
    assertEquals(NodeKind.DECISION, bare.getKind());
    assertEquals(Bounds.square(200, 10, 20), drawn.getBounds());

    final String idleId = nodes.get("Root/Idle").getId();
    int fromDecisions = 0;
    int intoDecisions = 0;
    for (final Transition edge : chart.getEdges()) {
      if (edge.getSourceId().equals(bare.getId()) || edge.getSourceId().equals(drawn.getId())) {
        assertEquals(idleId, edge.getTargetId());
        fromDecisions++;
      }
      if (edge.getSourceId().equals(idleId)) {
        assertTrue(edge.getTargetId().equals(bare.getId())
            || edge.getTargetId().equals(drawn.getId()));
        intoDecisions++;
      }
    }
    assertEquals(2, fromDecisions);
    assertEquals(2, intoDecisions);
  }

  @Test
  public void testDuplicateDecisionNameLastWins() throws StatechartException {
    final String text = "states:\n"
        + "  A:\n"
        + "    decisions:\n"
        + "      Check: []\n"
        + "  B:\n"
        + "    decisions:\n"
        + "      Check: []\n"
        + "    transitions:\n"
        + "      - to: '@Check'\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    final Map<String, ChartNode> nodes = byPath(chart);
    assertEquals(1, chart.getEdges().size());
    assertEquals(nodes.get("B/Check").getId(), chart.getEdges().get(0).getTargetId());
  }

  @Test
  public void testRootLevelDecisions() throws StatechartException {
    final String text = "states:\n"
        + "  Root:\n"
        + "    states:\n"
        + "      Idle: {}\n"
        + "decisions:\n"
        + "  Gate:\n"
        + "    - to: Root/Idle\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    final Map<String, ChartNode> nodes = byPath(chart);
    assertNull(nodes.get("Gate").getParentId());
    assertEquals(1, chart.getEdges().size());
    assertEquals(nodes.get("Root/Idle").getId(), chart.getEdges().get(0).getTargetId());
  }

  @Test
  public void testEdgeGeometryAndLegacyKey() throws StatechartException {
    final String text = "states:\n"
        + "  A:\n"
        + "    transitions:\n"
        + "      - to: B\n"
        + "        graphics:\n"
        + "          sourceHandle: right\n"
        + "          controlPoints:\n"
        + "            - {x: 1, y: 2}\n"
        + "          labelPosition: 0.25\n"
        + "      - to: B\n"
        + "        geometry: {targetHandle: left}\n"
        + "  B: {}\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    assertEquals(2, chart.getEdges().size());
    final EdgeGeometry first = chart.getEdges().get(0).getGeometry();
    assertEquals("right", first.getSourceHandle());
    assertNull(first.getTargetHandle());
    assertEquals(Point.of(1, 2), first.getControlPoints().get(0));
    assertEquals(0.25, first.getLabelPosition(), DELTA);
    assertEquals("left", chart.getEdges().get(1).getGeometry().getTargetHandle());
    assertEquals("enode_1-node_2-1", chart.getEdges().get(1).getId());
  }

  @Test
  public void testMachineProperties() throws StatechartException {
    final String text = "language: C\n"
        + "includes: '#include <stdio.h>'\n"
        + "context: |\n"
        + "  int count;\n"
        + "  int limit;\n"
        + "context_init: count = 0;\n"
        + "hooks:\n"
        + "  transition: trace();\n"
        + "do: tick();\n"
        + "initial: A\n"
        + "states:\n"
        + "  A: {}\n";
    final Chart chart = ChartDeserializer.deserialize(text, null);
    final MachineProperties properties = chart.getProperties();
    assertEquals("C", properties.getLanguage());
    assertEquals("#include <stdio.h>", properties.getIncludes());
    assertEquals("int count;\nint limit;\n", properties.getContext());
    assertEquals("count = 0;", properties.getContextInit());
    assertEquals("trace();", properties.getHooks().getTransition());
    assertEquals("tick();", properties.getDoAction());
    assertEquals(chart.getNodes().get(0).getId(), properties.getInitial());
  }

  @Test
  public void testEmptyDocument() throws StatechartException {
    final Chart chart = ChartDeserializer.deserialize("", null);
    assertTrue(chart.getNodes().isEmpty());
    assertTrue(chart.getEdges().isEmpty());
    assertTrue(ChartDeserializer.deserialize("   \n", null).getNodes().isEmpty());
  }

  @Test
  public void testMalformedDocument() {
    try {
      ChartDeserializer.deserialize("states: [unclosed\n  A: {", null);
      fail("Expected malformed document");
    } catch (StatechartException problem) {
      assertEquals(Code.MALFORMED_DOCUMENT, problem.getCode());
      assertNotNull(problem.getCause());
      assertEquals(problem.getCause().getMessage(), problem.getMessage());
    }
    try {
      ChartDeserializer.deserialize("- just\n- a list\n", null);
      fail("Expected malformed document");
    } catch (StatechartException problem) {
      assertEquals(Code.MALFORMED_DOCUMENT, problem.getCode());
    }
  }
}
