package com.github.statechart;

import java.util.Collection;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Stateless codec; the only thing it holds is its layout configuration.
 */
public final class StatechartCodecImpl implements StatechartCodec {
  private static final Logger logger =
      LogManager.getLogger(StatechartCodecImpl.class.getSimpleName());

  private final LayoutConfiguration layout;

  StatechartCodecImpl(final LayoutConfiguration layout) {
    this.layout = layout;
    logger.info("Created codec with " + layout);
  }

  @Override
  public String serialize(final Chart chart, final boolean includeGeometry) {
    return ChartSerializer.serialize(chart, includeGeometry);
  }

  @Override
  public String serialize(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges, final boolean rootHistory,
      final MachineProperties properties, final boolean includeGeometry) {
    return ChartSerializer.serialize(new Chart(nodes, edges, rootHistory, properties),
        includeGeometry);
  }

  @Override
  public Chart deserialize(final String document) throws StatechartException {
    return ChartDeserializer.deserialize(document, layout);
  }

  @Override
  public List<ConsistencyViolation> checkConsistency(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges) {
    return ConsistencyChecker.check(nodes, edges);
  }

  @Override
  public void assertConsistent(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges) throws StatechartException {
    ConsistencyChecker.assertConsistent(nodes, edges);
  }

  @Override
  public ExportResult exportPhoenix(final Chart chart) {
    return PhoenixExporter.export(chart);
  }

  @Override
  public LayoutConfiguration getLayout() {
    return layout;
  }
}
