package com.github.statechart;

import static com.github.statechart.DocumentYaml.hasText;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Exports a chart to the two-level Phoenix format: top-level states map to their child states,
 * each child carrying {@code in} and {@code out} code lines and a {@code next} table keyed by
 * guard. Whatever the format cannot hold is left out and described in the warnings; nothing here
 * throws for an unexpressible chart.
 */
public final class PhoenixExporter {
  private static final Logger logger = LogManager.getLogger(PhoenixExporter.class.getSimpleName());

  static final String ELSE_GUARD = "else";

  public static ExportResult export(final Chart chart) {
    final List<String> warnings = new ArrayList<>();
    final Map<String, ChartNode> nodesById = ChartPaths.index(chart.getNodes());

    final Map<String, List<Transition>> edgesBySource = new LinkedHashMap<>();
    for (final Transition edge : chart.getEdges()) {
      edgesBySource.computeIfAbsent(edge.getSourceId(), source -> new ArrayList<>()).add(edge);
    }

    for (final ChartNode node : chart.getNodes()) {
      if (node.getKind() == NodeKind.DECISION) {
        warnings.add("Decision node \"" + node.getLabel() + "\" was skipped");
      }
    }
    for (final ChartNode node : chart.getNodes()) {
      if (node.getKind() == NodeKind.STATE && levelOf(node, nodesById) > 2) {
        warnings.add("State \"" + ChartPaths.absolutePath(node.getId(), nodesById)
            + "\" is deeper than 2 levels and was skipped");
      }
    }

    final List<StateNode> topStates = new ArrayList<>();
    for (final ChartNode top : chart.childrenOf(null)) {
      if (top.getKind() == NodeKind.STATE) {
        topStates.add((StateNode) top);
      }
    }
    for (final StateNode top : topStates) {
      final String what = "Top-level state \"" + top.getLabel() + "\" has ";
      warnIgnored(warnings, what + "entry code", top.getEntry());
      warnIgnored(warnings, what + "exit code", top.getExit());
      warnIgnored(warnings, what + "'do' code", top.getDoAction());
    }
    for (final StateNode top : topStates) {
      for (final StateNode child : childStates(chart, top)) {
        warnIgnored(warnings, "State \"" + top.getLabel() + "/" + child.getLabel()
            + "\" has 'do' code", child.getDoAction());
      }
    }
    for (final StateNode top : topStates) {
      if (edgesBySource.containsKey(top.getId())) {
        warnings.add(
            "Top-level state \"" + top.getLabel() + "\" has transitions that were ignored");
      }
    }

    final Map<String, Object> document = new LinkedHashMap<>();
    for (final StateNode top : topStates) {
      final Map<String, Object> children = new LinkedHashMap<>();
      for (final StateNode child : childStates(chart, top)) {
        children.put(child.getLabel(),
            childRecord(top, child, edgesBySource.get(child.getId()), nodesById, warnings));
      }
      document.put(top.getLabel(), children.isEmpty() ? null : children);
    }

    if (!warnings.isEmpty()) {
      logger.warn("Phoenix export left out " + warnings.size() + " items");
    }
    return new ExportResult(DocumentYaml.dump(document), warnings);
  }

  private static Object childRecord(final ChartNode top, final StateNode child,
      final List<Transition> edges, final Map<String, ChartNode> nodesById,
      final List<String> warnings) {
    final String childPath = top.getLabel() + "/" + child.getLabel();

    final Map<String, Object> record = new LinkedHashMap<>();
    final List<String> in = lines(child.getEntry());
    if (!in.isEmpty()) {
      record.put("in", in);
    }
    final List<String> out = lines(child.getExit());
    if (!out.isEmpty()) {
      record.put("out", out);
    }

    // parallel lists, one slot per exported transition
    final List<String> guards = new ArrayList<>();
    final List<String> targets = new ArrayList<>();
    if (edges != null) {
      for (final Transition edge : edges) {
        final String target = phoenixTarget(edge.getTargetId(), nodesById);
        if (target != null) {
          guards.add(edge.getGuard().trim());
          targets.add(target);
        } else if (nodesById.containsKey(edge.getTargetId())) {
          warnings.add("Transition from \"" + childPath + "\" to \""
              + ChartPaths.absolutePath(edge.getTargetId(), nodesById)
              + "\" was skipped (target not in top 2 levels)");
        }
      }
    }
    if (targets.size() == 1 && guards.get(0).isEmpty()) {
      record.put("next", targets.get(0));
    } else if (!targets.isEmpty()) {
      final Map<String, Object> next = new LinkedHashMap<>();
      for (int iter = 0; iter < targets.size(); iter++) {
        final String guard = guards.get(iter);
        next.put(guard.isEmpty() ? ELSE_GUARD : guard, targets.get(iter));
      }
      record.put("next", next);
    }
    return record.isEmpty() ? null : record;
  }

  /**
   * "Top" or "Top Child"; null when the target is not a state within the top two levels. A proxy
   * target is followed to the state it stands for.
   */
  private static String phoenixTarget(final String targetId,
      final Map<String, ChartNode> nodesById) {
    ChartNode target = nodesById.get(targetId);
    if (target instanceof ProxyNode && !((ProxyNode) target).isBroken()) {
      target = nodesById.get(((ProxyNode) target).getTargetId());
    }
    if (target == null || target.getKind() != NodeKind.STATE) {
      return null;
    }
    final int level = levelOf(target, nodesById);
    if (level == 1) {
      return target.getLabel();
    }
    if (level == 2) {
      return nodesById.get(target.getParentId()).getLabel() + " " + target.getLabel();
    }
    return null;
  }

  private static List<StateNode> childStates(final Chart chart, final ChartNode top) {
    final List<StateNode> children = new ArrayList<>();
    for (final ChartNode child : chart.childrenOf(top.getId())) {
      if (child.getKind() == NodeKind.STATE) {
        children.add((StateNode) child);
      }
    }
    return children;
  }

  private static int levelOf(final ChartNode node, final Map<String, ChartNode> nodesById) {
    return ChartEdits.depth(node.getId(), nodesById) + 1;
  }

  private static List<String> lines(final String code) {
    final List<String> lines = new ArrayList<>();
    if (hasText(code)) {
      for (final String line : code.trim().split("\n")) {
        if (!line.trim().isEmpty()) {
          lines.add(line.trim());
        }
      }
    }
    return lines;
  }

  private static void warnIgnored(final List<String> warnings, final String what,
      final String code) {
    if (hasText(code)) {
      warnings.add(what + " that was ignored");
    }
  }

  private PhoenixExporter() {}
}
