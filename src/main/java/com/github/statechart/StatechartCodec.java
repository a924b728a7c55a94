package com.github.statechart;

import java.util.Collection;
import java.util.List;

/**
 * Converts statechart models to and from the nested YAML document format.
 * 
 * Notes for users:<br>
 * 1. the model is a flat forest: every node names its parent by id, and transitions name their
 * endpoints by id. The document is nested: states hold their children and their outgoing
 * transitions, which refer to their targets by relative path.<br>
 * 
 * 2. every operation is pure. Charts passed in are never mutated and charts handed out are fresh
 * snapshots, so a codec instance may be shared freely between threads.<br>
 * 
 * 3. geometry is optional on the way out and filled in by auto-layout on the way in, so a document
 * written without geometry still loads into a drawable chart.<br>
 * 
 * 4. references that do not resolve while loading are dropped rather than failing the load. Only
 * unparseable text is an error.<br>
 */
public interface StatechartCodec {

  /**
   * Serialize a chart, with or without layout geometry.
   */
  String serialize(final Chart chart, final boolean includeGeometry);

  /**
   * Serialize loose model pieces, the way an editor holds them.
   */
  String serialize(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges, final boolean rootHistory,
      final MachineProperties properties, final boolean includeGeometry);

  /**
   * Parse a document into a fresh chart with fresh node ids.
   */
  Chart deserialize(final String document) throws StatechartException;

  /**
   * Report referential integrity problems; an empty list means consistent.
   */
  List<ConsistencyViolation> checkConsistency(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges);

  /**
   * Throw one INCONSISTENT_MODEL exception listing every violation, if there are any.
   */
  void assertConsistent(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges) throws StatechartException;

  /**
   * Lossy export to the two-level Phoenix format.
   */
  ExportResult exportPhoenix(final Chart chart);

  /**
   * Returns the layout this codec auto-places nodes with.
   */
  LayoutConfiguration getLayout();

  /**
   * A simple builder to let users use fluent APIs to build codecs.
   */
  public final static class StatechartCodecBuilder {
    private LayoutConfiguration layout;

    public static StatechartCodecBuilder newBuilder() {
      return new StatechartCodecBuilder();
    }

    public StatechartCodecBuilder layout(final LayoutConfiguration layout) {
      this.layout = layout;
      return this;
    }

    public StatechartCodec build() {
      return new StatechartCodecImpl(layout == null ? LayoutConfiguration.defaults() : layout);
    }

    private StatechartCodecBuilder() {}
  }

}
