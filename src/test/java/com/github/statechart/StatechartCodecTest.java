package com.github.statechart;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.statechart.StatechartCodec.StatechartCodecBuilder;
import com.github.statechart.StatechartException.Code;

/**
 * Tests to maintain the sanity of the codec facade as collaborators use it.
 */
public class StatechartCodecTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger =
      LogManager.getLogger(StatechartCodecTest.class.getSimpleName());

  @Test
  public void testEditorWorkflow() throws StatechartException {
    // 1. build the codec with a custom layout
    final LayoutConfiguration layout = LayoutConfiguration.LayoutConfigurationBuilder.newBuilder()
        .topLevelOrigin(Point.of(10, 10)).build();
    final StatechartCodec codec = StatechartCodecBuilder.newBuilder().layout(layout).build();
    assertSame(layout, codec.getLayout());

    // 2. open a document
    final Chart opened = codec.deserialize("states:\n"
        + "  Idle:\n"
        + "    transitions:\n"
        + "      - to: Busy\n"
        + "  Busy: {}\n");
    assertEquals(10, opened.getNodes().get(0).getBounds().getX(), 1e-9);
    codec.assertConsistent(opened.getNodes(), opened.getEdges());

    // 3. edit: add a state with a fresh id, wire it up
    final IdSequence ids = IdSequence.continuingAfter(opened.getNodes());
    final List<ChartNode> nodes = new ArrayList<>(opened.getNodes());
    final String label = ChartEdits.uniqueLabel("Busy", null, nodes);
    final StateNode added = new StateNode(ids.nextId(), label);
    nodes.add(added);
    final List<Transition> edges = new ArrayList<>(opened.getEdges());
    edges.add(new Transition("e-new", opened.getNodes().get(1).getId(), added.getId()));
    codec.assertConsistent(nodes, edges);

    // 4. save, both entry points agree
    final String saved = codec.serialize(nodes, edges, false, opened.getProperties(), false);
    assertEquals(codec.serialize(new Chart(nodes, edges, false, opened.getProperties()), false),
        saved);
    logger.info("Saved:\n" + saved);
    final Chart reopened = codec.deserialize(saved);
    assertEquals(3, reopened.getNodes().size());
    assertEquals("Busy 2", reopened.getNodes().get(2).getLabel());
    assertEquals(2, reopened.getEdges().size());
  }

  @Test
  public void testDefaultsAndFailures() throws StatechartException {
    final StatechartCodec codec = StatechartCodecBuilder.newBuilder().build();
    assertEquals(LayoutConfiguration.defaults().toString(), codec.getLayout().toString());
    assertTrue(codec.deserialize(null).getNodes().isEmpty());

    final List<ChartNode> nodes = new ArrayList<>();
    nodes.add(new StateNode("n1", "Lost", "n0"));
    assertEquals(1, codec.checkConsistency(nodes, new ArrayList<Transition>()).size());
    try {
      codec.assertConsistent(nodes, new ArrayList<Transition>());
      fail("Expected inconsistent model");
    } catch (StatechartException problem) {
      assertEquals(Code.INCONSISTENT_MODEL, problem.getCode());
    }
    try {
      codec.deserialize("{ not: [closed");
      fail("Expected malformed document");
    } catch (StatechartException problem) {
      assertEquals(Code.MALFORMED_DOCUMENT, problem.getCode());
    }
    assertTrue(codec.exportPhoenix(Chart.empty()).isLossless());
  }
}
