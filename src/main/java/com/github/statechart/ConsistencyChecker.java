package com.github.statechart;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.github.statechart.StatechartException.Code;

/**
 * Referential-integrity checks over an arbitrary graph snapshot, typically run after compound
 * edits (paste, duplicate, cascade delete) and after a load. Checks:<br>
 * - every edge source and target names an existing node<br>
 * - every parentId names an existing node<br>
 * - every proxy not marked broken targets an existing node<br>
 * - every state's initial names an existing node<br>
 *
 * Sibling label uniqueness is an edit-time rule and is not checked here.
 */
public final class ConsistencyChecker {

  /**
   * Returns all violations; an empty list means the snapshot is clean. Never throws.
   */
  public static List<ConsistencyViolation> check(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges) {
    final List<ConsistencyViolation> violations = new ArrayList<>();
    final Set<String> nodeIds = new HashSet<>();
    for (final ChartNode node : nodes) {
      nodeIds.add(node.getId());
    }

    for (final Transition edge : edges) {
      if (!nodeIds.contains(edge.getSourceId())) {
        violations.add(new ConsistencyViolation(ViolationKind.DANGLING_EDGE_SOURCE, "Edge \""
            + edge.getId() + "\" has source \"" + edge.getSourceId() + "\" which does not exist"));
      }
      if (!nodeIds.contains(edge.getTargetId())) {
        violations.add(new ConsistencyViolation(ViolationKind.DANGLING_EDGE_TARGET, "Edge \""
            + edge.getId() + "\" has target \"" + edge.getTargetId() + "\" which does not exist"));
      }
    }

    for (final ChartNode node : nodes) {
      if (node.getParentId() != null && !nodeIds.contains(node.getParentId())) {
        violations.add(new ConsistencyViolation(ViolationKind.DANGLING_PARENT,
            "Node \"" + node.getId() + "\" (\"" + node.getLabel() + "\") has parentId \""
                + node.getParentId() + "\" which does not exist"));
      }
      if (node instanceof ProxyNode) {
        final ProxyNode proxy = (ProxyNode) node;
        if (proxy.getTargetId() != null && !proxy.isBroken()
            && !nodeIds.contains(proxy.getTargetId())) {
          violations.add(new ConsistencyViolation(ViolationKind.BROKEN_PROXY_TARGET,
              "Proxy node \"" + proxy.getId() + "\" has targetId \"" + proxy.getTargetId()
                  + "\" which does not exist"));
        }
      }
      if (node instanceof StateNode) {
        final String initial = ((StateNode) node).getInitial();
        if (initial != null && !nodeIds.contains(initial)) {
          violations.add(new ConsistencyViolation(ViolationKind.DANGLING_INITIAL,
              "Node \"" + node.getId() + "\" (\"" + node.getLabel() + "\") has initial \""
                  + initial + "\" which does not exist"));
        }
      }
    }
    return violations;
  }

  /**
   * Throws one exception listing every violation, or returns quietly on a clean snapshot.
   */
  public static void assertConsistent(final Collection<? extends ChartNode> nodes,
      final Collection<Transition> edges) throws StatechartException {
    final List<ConsistencyViolation> violations = check(nodes, edges);
    if (!violations.isEmpty()) {
      final StringBuilder message = new StringBuilder("Model consistency violations:");
      for (final ConsistencyViolation violation : violations) {
        message.append("\n  ").append(violation);
      }
      throw new StatechartException(Code.INCONSISTENT_MODEL, message.toString());
    }
  }

  private ConsistencyChecker() {}
}
