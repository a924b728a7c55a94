package com.github.statechart;

import static com.github.statechart.DocumentYaml.flag;
import static com.github.statechart.DocumentYaml.hasText;
import static com.github.statechart.DocumentYaml.mapping;
import static com.github.statechart.DocumentYaml.number;
import static com.github.statechart.DocumentYaml.sequence;
import static com.github.statechart.DocumentYaml.text;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rebuilds a chart from document text in two passes. Pass 1 walks the nested records top-down,
 * mints a fresh id per state and decision, and applies saved geometry or auto-layout. Pass 2, run
 * only once pass 1 is complete, resolves every transition target and every {@code initial} name,
 * since both may point at records visited later.
 *
 * A reference that resolves to nothing is dropped, not reported; the consistency checker is where
 * such omissions surface.
 *
 * An instance lives for exactly one deserialization.
 */
public final class ChartDeserializer {
  private static final Logger logger =
      LogManager.getLogger(ChartDeserializer.class.getSimpleName());

  private final LayoutConfiguration layout;
  private final IdSequence ids = new IdSequence();

  private final List<ChartNode> nodes = new ArrayList<>();
  private final List<Transition> edges = new ArrayList<>();

  // states are referenced by path, decisions by bare name; two namespaces, never merged
  private final Map<String, StateNode> statesByPath = new HashMap<>();
  private final Map<String, String> decisionIdsByName = new HashMap<>();

  // filled by pass 1, drained by pass 2
  private final List<PendingTransitions> pendingTransitions = new ArrayList<>();
  private final List<PendingInitial> pendingInitials = new ArrayList<>();

  private int droppedReferences;

  /**
   * Deserialize document text into a new chart.
   */
  public static Chart deserialize(final String text, final LayoutConfiguration layout)
      throws StatechartException {
    return new ChartDeserializer(layout).toChart(DocumentYaml.load(text));
  }

  private ChartDeserializer(final LayoutConfiguration layout) {
    this.layout = layout == null ? LayoutConfiguration.defaults() : layout;
  }

  private Chart toChart(final Map<?, ?> document) throws StatechartException {
    // pass 1: structure
    final Map<?, ?> states = mapping(document, "states");
    double topLevelX = layout.getTopLevelOrigin().getX();
    final double topLevelY = layout.getTopLevelOrigin().getY();
    if (states != null) {
      for (final Map.Entry<?, ?> entry : states.entrySet()) {
        final Bounds bounds = readState(String.valueOf(entry.getKey()), asRecord(entry.getValue()),
            null, "", topLevelX, topLevelY);
        topLevelX += bounds.getWidth() + layout.getHorizontalGap();
      }
    }
    final Map<?, ?> rootDecisions = mapping(document, "decisions");
    if (rootDecisions != null) {
      readDecisions(rootDecisions, null, "", topLevelX, topLevelY);
    }

    // pass 2: references
    for (final PendingTransitions pending : pendingTransitions) {
      resolveTransitions(pending);
    }
    for (final PendingInitial pending : pendingInitials) {
      resolveInitial(pending.state, pending.childPath);
    }

    final MachineProperties properties = readProperties(document);
    final boolean rootHistory = flag(document, "history");
    if (rootHistory && properties.getHistoryMarker() == null) {
      properties.setHistoryMarker(layout.getRootHistoryMarker());
    }
    if (hasText(text(document, "initial"))) {
      final StateNode rootInitial = statesByPath.get(text(document, "initial"));
      if (rootInitial != null && rootInitial.isTopLevel()) {
        properties.setInitial(rootInitial.getId());
      } else {
        dropped("root initial", text(document, "initial"));
      }
    }

    logger.info(String.format("Deserialized %d nodes, %d transitions, dropped %d references",
        nodes.size(), edges.size(), droppedReferences));
    return new Chart(nodes, edges, rootHistory, properties);
  }

  /**
   * Allocates a state and its whole subtree; returns the state's final bounds.
   */
  private Bounds readState(final String name, final Map<?, ?> record, final String parentId,
      final String parentPath, final double x, final double y) {
    final String path = ChartPaths.join(parentPath, name);
    final StateNode state = new StateNode(ids.nextId(), name, parentId);
    statesByPath.put(path, state);

    state.setEntry(text(record, "entry"));
    state.setExit(text(record, "exit"));
    state.setDoAction(text(record, "do"));
    state.setAnnotation(text(record, "annotation"));
    state.setHistory(flag(record, "history"));
    state.setOrthogonal(flag(record, "orthogonal"));

    final Map<?, ?> graphics = mapping(record, "graphics");
    Bounds bounds = Bounds.of(x, y, layout.getDefaultWidth(), layout.getDefaultHeight());
    if (graphics != null) {
      bounds = Bounds.of(number(graphics, "x", x), number(graphics, "y", y),
          number(graphics, "width", layout.getDefaultWidth()),
          number(graphics, "height", layout.getDefaultHeight()));
      state.setInitialMarker(DocumentYaml.marker(graphics, "initialMarkerPos", "initialMarkerSize"));
      state.setHistoryMarker(DocumentYaml.marker(graphics, "historyMarkerPos", "historyMarkerSize"));
      state.setShowAnnotation(flag(graphics, "showAnnotation"));
      state.setShowEntry(flag(graphics, "showEntry"));
      state.setShowDo(flag(graphics, "showDo"));
      state.setShowExit(flag(graphics, "showExit"));
    }
    // parent goes in before its children
    nodes.add(state);

    final double childY = layout.getChildOrigin().getY();
    double childX = layout.getChildOrigin().getX();
    double rowRight = 0;
    double rowHeight = 0;
    final Map<?, ?> children = mapping(record, "states");
    if (children != null) {
      for (final Map.Entry<?, ?> entry : children.entrySet()) {
        final Bounds childBounds = readState(String.valueOf(entry.getKey()),
            asRecord(entry.getValue()), state.getId(), path, childX, childY);
        rowRight = childX + childBounds.getWidth();
        rowHeight = Math.max(rowHeight, childBounds.getHeight());
        childX = rowRight + layout.getHorizontalGap();
      }
    }
    final Map<?, ?> decisions = mapping(record, "decisions");
    if (decisions != null && !decisions.isEmpty()) {
      rowRight = Math.max(rowRight, readDecisions(decisions, state.getId(), path, childX, childY));
      rowHeight = Math.max(rowHeight, maxDecisionSize(decisions));
    }

    if (graphics == null && rowRight > 0) {
      bounds = bounds.resize(Math.max(layout.getDefaultWidth(), rowRight + layout.getPaddingRight()),
          Math.max(layout.getDefaultHeight(), rowHeight + childY + layout.getPaddingBottom()));
    }
    state.setBounds(bounds);
    if (state.isHistory() && state.getHistoryMarker() == null) {
      state.setHistoryMarker(layout.historyMarkerFor(bounds.getWidth(), bounds.getHeight()));
    }

    final List<?> transitions = sequence(record.get("transitions"));
    if (!transitions.isEmpty()) {
      pendingTransitions.add(new PendingTransitions(state.getId(), path, transitions));
    }
    if (hasText(text(record, "initial"))) {
      pendingInitials.add(
          new PendingInitial(state, ChartPaths.join(path, text(record, "initial"))));
    }
    return bounds;
  }

  /**
   * Allocates the decisions of one scope in a row; returns the row's right edge.
   */
  private double readDecisions(final Map<?, ?> decisions, final String parentId,
      final String contextPath, final double x, final double y) {
    double dx = x;
    double rowRight = x;
    for (final Map.Entry<?, ?> entry : decisions.entrySet()) {
      final String name = String.valueOf(entry.getKey());
      final DecisionNode decision = new DecisionNode(ids.nextId(), name, parentId);
      final String previous = decisionIdsByName.put(name, decision.getId());
      if (previous != null) {
        logger.warn("Decision name " + name + " is defined more than once; @" + name
            + " now refers to " + decision.getId() + " instead of " + previous);
      }

      final Object value = entry.getValue();
      final Map<?, ?> graphics = value instanceof Map ? mapping((Map<?, ?>) value, "graphics") : null;
      final double size = graphics == null ? layout.getDefaultDecisionSize()
          : number(graphics, "size", layout.getDefaultDecisionSize());
      decision.setBounds(graphics == null ? Bounds.square(dx, y, size)
          : Bounds.square(number(graphics, "x", dx), number(graphics, "y", y), size));
      nodes.add(decision);

      final List<?> transitions = value instanceof Map
          ? sequence(((Map<?, ?>) value).get("transitions"))
          : sequence(value);
      if (!transitions.isEmpty()) {
        // a decision speaks from its parent state's path
        pendingTransitions.add(new PendingTransitions(decision.getId(), contextPath, transitions));
      }
      rowRight = dx + size;
      dx += size + layout.getHorizontalGap();
    }
    return rowRight;
  }

  private void resolveTransitions(final PendingTransitions pending) throws StatechartException {
    for (final Object item : pending.transitions) {
      if (!(item instanceof Map)) {
        continue;
      }
      final Map<?, ?> record = (Map<?, ?>) item;
      final String to = text(record, "to");
      if (!hasText(to)) {
        continue;
      }
      final String targetId = resolveTarget(to, pending.contextPath);
      if (targetId == null) {
        dropped("transition from " + pending.sourceId, to);
        continue;
      }
      final Transition edge = new Transition("e" + pending.sourceId + "-" + targetId + "-"
          + edges.size(), pending.sourceId, targetId, text(record, "guard"),
          text(record, "action"));
      Map<?, ?> graphics = mapping(record, "graphics");
      if (graphics == null) {
        graphics = mapping(record, "geometry");
      }
      if (graphics != null) {
        edge.setGeometry(readEdgeGeometry(graphics));
      }
      edges.add(edge);
    }
  }

  private String resolveTarget(final String reference, final String contextPath) {
    if (ChartPaths.isDecisionReference(reference)) {
      return decisionIdsByName.get(ChartPaths.decisionName(reference));
    }
    final StateNode target = statesByPath.get(ChartPaths.resolve(reference, contextPath));
    return target == null ? null : target.getId();
  }

  private void resolveInitial(final StateNode state, final String childPath) {
    final StateNode child = statesByPath.get(childPath);
    if (child != null && state.getId().equals(child.getParentId())) {
      state.setInitial(child.getId());
    } else {
      dropped("initial of " + state.getLabel(), childPath);
    }
  }

  private static EdgeGeometry readEdgeGeometry(final Map<?, ?> graphics) {
    final List<Point> controlPoints = new ArrayList<>();
    for (final Object item : sequence(graphics.get("controlPoints"))) {
      if (item instanceof Map) {
        final Map<?, ?> point = (Map<?, ?>) item;
        controlPoints.add(Point.of(number(point, "x", 0), number(point, "y", 0)));
      }
    }
    final String sourceHandle = text(graphics, "sourceHandle");
    final String targetHandle = text(graphics, "targetHandle");
    return new EdgeGeometry(sourceHandle.isEmpty() ? null : sourceHandle,
        targetHandle.isEmpty() ? null : targetHandle, controlPoints,
        number(graphics, "labelPosition"));
  }

  private static MachineProperties readProperties(final Map<?, ?> document) {
    final MachineProperties properties = new MachineProperties();
    properties.setLanguage(text(document, "language"));
    properties.setIncludes(text(document, "includes"));
    properties.setContext(text(document, "context"));
    properties.setContextInit(text(document, "context_init"));
    properties.setEntry(text(document, "entry"));
    properties.setExit(text(document, "exit"));
    properties.setDoAction(text(document, "do"));
    final Map<?, ?> hookRecord = mapping(document, "hooks");
    if (hookRecord != null) {
      final MachineProperties.Hooks hooks = new MachineProperties.Hooks();
      hooks.setEntry(text(hookRecord, "entry"));
      hooks.setExit(text(hookRecord, "exit"));
      hooks.setDoAction(text(hookRecord, "do"));
      hooks.setTransition(text(hookRecord, "transition"));
      properties.setHooks(hooks);
    }
    final Map<?, ?> graphics = mapping(document, "graphics");
    if (graphics != null) {
      properties.setInitialMarker(
          DocumentYaml.marker(graphics, "initialMarkerPos", "initialMarkerSize"));
      properties.setHistoryMarker(
          DocumentYaml.marker(graphics, "historyMarkerPos", "historyMarkerSize"));
    }
    return properties;
  }

  private double maxDecisionSize(final Map<?, ?> decisions) {
    double max = 0;
    for (final Object value : decisions.values()) {
      final Map<?, ?> graphics = value instanceof Map ? mapping((Map<?, ?>) value, "graphics") : null;
      max = Math.max(max, graphics == null ? layout.getDefaultDecisionSize()
          : number(graphics, "size", layout.getDefaultDecisionSize()));
    }
    return max;
  }

  private void dropped(final String what, final String reference) {
    droppedReferences++;
    if (logger.isDebugEnabled()) {
      logger.debug("Dropped unresolved " + what + ": " + reference);
    }
  }

  private static Map<?, ?> asRecord(final Object value) {
    return value instanceof Map ? (Map<?, ?>) value : new HashMap<>();
  }

  /**
   * Transitions declared by one state or decision, with the path they are written relative to.
   */
  private static final class PendingTransitions {
    private final String sourceId;
    private final String contextPath;
    private final List<?> transitions;

    private PendingTransitions(final String sourceId, final String contextPath,
        final List<?> transitions) {
      this.sourceId = sourceId;
      this.contextPath = contextPath;
      this.transitions = transitions;
    }
  }

  private static final class PendingInitial {
    private final StateNode state;
    // absolute path of the declared initial child
    private final String childPath;

    private PendingInitial(final StateNode state, final String childPath) {
      this.state = state;
      this.childPath = childPath;
    }
  }
}
