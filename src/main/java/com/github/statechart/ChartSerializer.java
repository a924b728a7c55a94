package com.github.statechart;

import static com.github.statechart.DocumentYaml.hasText;
import static com.github.statechart.DocumentYaml.numeric;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks a chart top-down and emits the nested document: one record per state, holding its
 * actions, flags, optional geometry, decision children, state children and outgoing transitions.
 * Empty fields are left out. Proxies are not written; transitions ending on a proxy are written
 * against the proxy's target.
 *
 * An instance lives for exactly one serialization.
 */
public final class ChartSerializer {
  private static final Logger logger = LogManager.getLogger(ChartSerializer.class.getSimpleName());

  private final Chart chart;
  private final boolean includeGeometry;

  private final Map<String, ChartNode> nodesById;
  // K=node.id, V=absolute path
  private final Map<String, String> pathsById;
  // K=parent.id (null for roots), V=children in document order
  private final Map<String, List<ChartNode>> childrenByParent = new HashMap<>();
  // K=source.id, V=outgoing edges in document order
  private final Map<String, List<Transition>> edgesBySource = new HashMap<>();

  private int writtenStates;
  private int writtenDecisions;
  private int writtenTransitions;

  /**
   * Serialize the chart into document text.
   */
  public static String serialize(final Chart chart, final boolean includeGeometry) {
    return DocumentYaml.dump(new ChartSerializer(chart, includeGeometry).toDocument());
  }

  /**
   * Serialize the chart into the nested document tree, before YAML rendering.
   */
  static Map<String, Object> toDocumentTree(final Chart chart, final boolean includeGeometry) {
    return new ChartSerializer(chart, includeGeometry).toDocument();
  }

  private ChartSerializer(final Chart chart, final boolean includeGeometry) {
    this.chart = chart;
    this.includeGeometry = includeGeometry;
    this.nodesById = ChartPaths.index(chart.getNodes());
    this.pathsById = ChartPaths.pathsById(chart.getNodes());
    for (final ChartNode node : chart.getNodes()) {
      childrenByParent.computeIfAbsent(node.getParentId(), parent -> new ArrayList<>()).add(node);
    }
    for (final Transition edge : chart.getEdges()) {
      final ChartNode source = nodesById.get(edge.getSourceId());
      if (source == null || source.getKind() == NodeKind.PROXY) {
        logger.warn("Skipping transition " + edge.getId() + " from "
            + (source == null ? "missing node " : "proxy ") + edge.getSourceId());
        continue;
      }
      edgesBySource.computeIfAbsent(edge.getSourceId(), src -> new ArrayList<>()).add(edge);
    }
  }

  private Map<String, Object> toDocument() {
    final MachineProperties properties = chart.getProperties();
    final Map<String, Object> document = new LinkedHashMap<>();

    putText(document, "language", properties.getLanguage());
    putText(document, "includes", properties.getIncludes());
    putText(document, "context", properties.getContext());
    putText(document, "context_init", properties.getContextInit());

    final MachineProperties.Hooks hooks = properties.getHooks();
    final Map<String, Object> hookRecord = new LinkedHashMap<>();
    putText(hookRecord, "entry", hooks.getEntry());
    putText(hookRecord, "exit", hooks.getExit());
    putText(hookRecord, "do", hooks.getDoAction());
    putText(hookRecord, "transition", hooks.getTransition());
    if (!hookRecord.isEmpty()) {
      document.put("hooks", hookRecord);
    }

    putText(document, "entry", properties.getEntry());
    putText(document, "exit", properties.getExit());
    putText(document, "do", properties.getDoAction());

    final Map<String, Object> rootGraphics = new LinkedHashMap<>();
    if (chart.isRootHistory()) {
      document.put("history", Boolean.TRUE);
      if (includeGeometry) {
        putMarker(rootGraphics, "historyMarker", properties.getHistoryMarker());
      }
    }
    final ChartNode rootInitial = nodesById.get(properties.getInitial());
    if (rootInitial != null && rootInitial.isTopLevel() && rootInitial.getKind() == NodeKind.STATE) {
      document.put("initial", rootInitial.getLabel());
      if (includeGeometry) {
        putMarker(rootGraphics, "initialMarker", properties.getInitialMarker());
      }
    }
    if (!rootGraphics.isEmpty()) {
      document.put("graphics", rootGraphics);
    }

    final Map<String, Object> states = stateRecords(null);
    if (!states.isEmpty()) {
      document.put("states", states);
    }
    final Map<String, Object> decisions = decisionRecords(null);
    if (!decisions.isEmpty()) {
      document.put("decisions", decisions);
    }

    logger.info(String.format("Serialized %d states, %d decisions, %d transitions", writtenStates,
        writtenDecisions, writtenTransitions));
    return document;
  }

  private Map<String, Object> stateRecord(final StateNode state) {
    writtenStates++;
    final Map<String, Object> record = new LinkedHashMap<>();
    putText(record, "entry", state.getEntry());
    putText(record, "exit", state.getExit());
    putText(record, "do", state.getDoAction());
    putText(record, "annotation", state.getAnnotation());
    if (state.isHistory()) {
      record.put("history", Boolean.TRUE);
    }
    if (state.isOrthogonal()) {
      record.put("orthogonal", Boolean.TRUE);
    }

    final ChartNode initialChild = nodesById.get(state.getInitial());
    final boolean initialResolves = initialChild != null && initialChild.getKind() == NodeKind.STATE
        && state.getId().equals(initialChild.getParentId());
    if (initialResolves) {
      record.put("initial", initialChild.getLabel());
    }

    if (includeGeometry && state.getBounds() != null) {
      final Bounds bounds = state.getBounds();
      final Map<String, Object> graphics = new LinkedHashMap<>();
      graphics.put("x", numeric(bounds.getX()));
      graphics.put("y", numeric(bounds.getY()));
      graphics.put("width", numeric(bounds.getWidth()));
      graphics.put("height", numeric(bounds.getHeight()));
      if (initialResolves) {
        putMarker(graphics, "initialMarker", state.getInitialMarker());
      }
      if (state.isHistory()) {
        putMarker(graphics, "historyMarker", state.getHistoryMarker());
      }
      putFlag(graphics, "showAnnotation", state.isShowAnnotation());
      putFlag(graphics, "showEntry", state.isShowEntry());
      putFlag(graphics, "showDo", state.isShowDo());
      putFlag(graphics, "showExit", state.isShowExit());
      record.put("graphics", graphics);
    }

    final Map<String, Object> decisions = decisionRecords(state.getId());
    if (!decisions.isEmpty()) {
      record.put("decisions", decisions);
    }
    final Map<String, Object> states = stateRecords(state.getId());
    if (!states.isEmpty()) {
      record.put("states", states);
    }
    final List<Object> transitions = transitionRecords(state);
    if (!transitions.isEmpty()) {
      record.put("transitions", transitions);
    }
    return record;
  }

  private Map<String, Object> stateRecords(final String parentId) {
    final Map<String, Object> states = new LinkedHashMap<>();
    for (final ChartNode child : children(parentId)) {
      if (child.getKind() == NodeKind.STATE) {
        states.put(child.getLabel(), stateRecord((StateNode) child));
      }
    }
    return states;
  }

  private Map<String, Object> decisionRecords(final String parentId) {
    final Map<String, Object> decisions = new LinkedHashMap<>();
    for (final ChartNode child : children(parentId)) {
      if (child.getKind() != NodeKind.DECISION) {
        continue;
      }
      writtenDecisions++;
      final List<Object> transitions = transitionRecords(child);
      if (includeGeometry && child.getBounds() != null) {
        final Map<String, Object> graphics = new LinkedHashMap<>();
        graphics.put("x", numeric(child.getBounds().getX()));
        graphics.put("y", numeric(child.getBounds().getY()));
        graphics.put("size", numeric(child.getBounds().getWidth()));
        final Map<String, Object> record = new LinkedHashMap<>();
        record.put("transitions", transitions);
        record.put("graphics", graphics);
        decisions.put(child.getLabel(), record);
      } else {
        decisions.put(child.getLabel(), transitions);
      }
    }
    return decisions;
  }

  private List<Object> transitionRecords(final ChartNode source) {
    final List<Transition> edges = edgesBySource.get(source.getId());
    if (edges == null) {
      return new ArrayList<>();
    }
    final List<Object> transitions = new ArrayList<>(edges.size());
    for (final Transition edge : edges) {
      final String to = resolveTarget(source, edge);
      if (to == null) {
        continue;
      }
      final Map<String, Object> record = new LinkedHashMap<>();
      record.put("to", to);
      putText(record, "guard", edge.getGuard());
      putText(record, "action", edge.getAction());
      final EdgeGeometry geometry = edge.getGeometry();
      if (includeGeometry && geometry != null && !geometry.isEmpty()) {
        final Map<String, Object> graphics = new LinkedHashMap<>();
        putText(graphics, "sourceHandle", geometry.getSourceHandle());
        putText(graphics, "targetHandle", geometry.getTargetHandle());
        if (!geometry.getControlPoints().isEmpty()) {
          graphics.put("controlPoints", DocumentYaml.points(geometry.getControlPoints()));
        }
        if (geometry.getLabelPosition() != null) {
          graphics.put("labelPosition", numeric(geometry.getLabelPosition()));
        }
        record.put("graphics", graphics);
      }
      transitions.add(record);
      writtenTransitions++;
    }
    return transitions;
  }

  /**
   * Reference written in a transition's {@code to} field, or null when the edge cannot be
   * expressed and has to be skipped.
   */
  private String resolveTarget(final ChartNode source, final Transition edge) {
    ChartNode target = nodesById.get(edge.getTargetId());
    if (target instanceof ProxyNode) {
      final ProxyNode proxy = (ProxyNode) target;
      target = proxy.isBroken() ? null : nodesById.get(proxy.getTargetId());
      if (target == null || target.getKind() == NodeKind.PROXY) {
        logger.warn("Skipping transition " + edge.getId() + " to broken proxy " + proxy.getId());
        return null;
      }
    }
    if (target == null) {
      logger.warn("Skipping transition " + edge.getId() + " to missing node "
          + edge.getTargetId());
      return null;
    }
    if (target.getKind() == NodeKind.DECISION) {
      return ChartPaths.decisionReference(target.getLabel());
    }

    // a decision has no path of its own, it speaks from its parent state
    final String sourcePath;
    if (source.getKind() == NodeKind.DECISION) {
      sourcePath = source.getParentId() == null ? "" : pathsById.get(source.getParentId());
    } else {
      sourcePath = pathsById.get(source.getId());
    }
    return ChartPaths.relativePath(sourcePath == null ? "" : sourcePath,
        pathsById.get(target.getId()));
  }

  private List<ChartNode> children(final String parentId) {
    final List<ChartNode> children = childrenByParent.get(parentId);
    return children == null ? Collections.<ChartNode>emptyList() : children;
  }

  private static void putText(final Map<String, Object> record, final String key,
      final String value) {
    if (hasText(value)) {
      record.put(key, value);
    }
  }

  private static void putFlag(final Map<String, Object> record, final String key,
      final boolean value) {
    if (value) {
      record.put(key, Boolean.TRUE);
    }
  }

  private static void putMarker(final Map<String, Object> graphics, final String prefix,
      final Marker marker) {
    if (marker != null) {
      graphics.put(prefix + "Pos", DocumentYaml.point(marker.getPosition()));
      graphics.put(prefix + "Size", numeric(marker.getSize()));
    }
  }
}
