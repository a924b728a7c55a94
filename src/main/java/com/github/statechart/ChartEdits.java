package com.github.statechart;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statechart.StatechartException.Code;

/**
 * Structural edits that keep a chart internally consistent. Every edit works on a deep copy and
 * returns a new chart; the chart passed in is never touched, so the editor decides when the new
 * snapshot becomes current.
 */
public final class ChartEdits {
  private static final Logger logger = LogManager.getLogger(ChartEdits.class.getSimpleName());

  /**
   * Deletes the selected nodes together with all their descendants, every proxy targeting any
   * removed node, and every edge touching any removed node. The full removal set is computed
   * before edges are filtered, so edges into cascaded proxies go as well.
   */
  public static Chart cascadeDelete(final Chart chart, final Collection<String> selectedIds) {
    final Set<String> removeIds = removalSet(chart.getNodes(), selectedIds);
    final Chart copy = chart.copy();

    final List<ChartNode> survivors = new ArrayList<>();
    for (final ChartNode node : copy.getNodes()) {
      if (removeIds.contains(node.getId())) {
        continue;
      }
      if (node instanceof StateNode && removeIds.contains(((StateNode) node).getInitial())) {
        ((StateNode) node).setInitial(null);
      }
      survivors.add(node);
    }
    final List<Transition> edges = new ArrayList<>();
    for (final Transition edge : copy.getEdges()) {
      if (!removeIds.contains(edge.getSourceId()) && !removeIds.contains(edge.getTargetId())) {
        edges.add(edge);
      }
    }
    final MachineProperties properties = copy.getProperties();
    if (removeIds.contains(properties.getInitial())) {
      properties.setInitial(null);
    }

    logger.info(String.format("Cascade delete of %d selected removed %d nodes and %d edges",
        selectedIds.size(), chart.getNodes().size() - survivors.size(),
        chart.getEdges().size() - edges.size()));
    return new Chart(survivors, edges, copy.isRootHistory(), properties);
  }

  /**
   * The transitive removal set: selection, descendants, proxies of anything removed, and their
   * descendants in turn, until nothing more is added.
   */
  static Set<String> removalSet(final List<ChartNode> nodes, final Collection<String> selectedIds) {
    final Set<String> removeIds = new LinkedHashSet<>(selectedIds);
    boolean grew = true;
    while (grew) {
      grew = false;
      for (final String id : new ArrayList<>(removeIds)) {
        for (final ChartNode descendant : descendants(id, nodes)) {
          grew |= removeIds.add(descendant.getId());
        }
      }
      for (final ChartNode node : nodes) {
        if (node instanceof ProxyNode && removeIds.contains(((ProxyNode) node).getTargetId())) {
          grew |= removeIds.add(node.getId());
        }
      }
    }
    return removeIds;
  }

  /**
   * Renames a state or decision; the new label must be a legal path segment that no sibling uses.
   * A decision's new name must also be free among all decisions of the chart.
   */
  public static Chart rename(final Chart chart, final String nodeId, final String label)
      throws StatechartException {
    validateLabel(label);
    final ChartNode node = require(chart, nodeId);
    requireFreeLabel(chart.getNodes(), label, node.getParentId(), nodeId);
    if (node.getKind() == NodeKind.DECISION) {
      requireFreeDecisionName(chart.getNodes(), label, nodeId);
    }

    final Chart copy = chart.copy();
    copy.findNode(nodeId).setLabel(label);
    refreshProxyPaths(copy.getNodes());
    return copy;
  }

  /**
   * Reparents a node; null moves it to the top level. An initial reference to the node from its
   * old scope is cleared since it would no longer name a direct child.
   */
  public static Chart move(final Chart chart, final String nodeId, final String newParentId)
      throws StatechartException {
    final ChartNode node = require(chart, nodeId);
    if (newParentId != null) {
      final ChartNode newParent = require(chart, newParentId);
      if (newParentId.equals(nodeId) || isAncestorOf(nodeId, newParentId, chart.getNodes())) {
        throw new StatechartException(Code.ILLEGAL_MOVE,
            "Cannot move " + nodeId + " under itself or its descendant " + newParentId);
      }
      if (newParent.getKind() != NodeKind.STATE) {
        throw new StatechartException(Code.ILLEGAL_MOVE,
            "Only states can hold children, " + newParentId + " is a " + newParent.getKind());
      }
    }
    if (newParentId == null ? node.getParentId() == null : newParentId.equals(node.getParentId())) {
      return chart.copy();
    }
    requireFreeLabel(chart.getNodes(), node.getLabel(), newParentId, nodeId);

    final Chart copy = chart.copy();
    final ChartNode oldParent = copy.findNode(node.getParentId());
    if (oldParent instanceof StateNode && nodeId.equals(((StateNode) oldParent).getInitial())) {
      ((StateNode) oldParent).setInitial(null);
    }
    if (node.getParentId() == null && nodeId.equals(copy.getProperties().getInitial())) {
      copy.getProperties().setInitial(null);
    }
    copy.findNode(nodeId).setParentId(newParentId);
    refreshProxyPaths(copy.getNodes());
    return copy;
  }

  /**
   * All descendants of a node, breadth first. Unknown ids have none.
   */
  public static List<ChartNode> descendants(final String nodeId,
      final Collection<? extends ChartNode> nodes) {
    final Map<String, List<ChartNode>> childrenByParent = new HashMap<>();
    for (final ChartNode node : nodes) {
      if (node.getParentId() != null) {
        childrenByParent.computeIfAbsent(node.getParentId(), parent -> new ArrayList<>())
            .add(node);
      }
    }
    final List<ChartNode> descendants = new ArrayList<>();
    final Set<String> visited = new HashSet<>();
    final Deque<String> queue = new ArrayDeque<>();
    queue.add(nodeId);
    while (!queue.isEmpty()) {
      final String currentId = queue.poll();
      if (!visited.add(currentId)) {
        continue;
      }
      for (final ChartNode child : childrenByParent.getOrDefault(currentId,
          new ArrayList<ChartNode>())) {
        if (!visited.contains(child.getId())) {
          descendants.add(child);
          queue.add(child.getId());
        }
      }
    }
    return descendants;
  }

  public static boolean isAncestorOf(final String ancestorId, final String descendantId,
      final Collection<? extends ChartNode> nodes) {
    final Map<String, ChartNode> nodesById = ChartPaths.index(nodes);
    final Set<String> visited = new HashSet<>();
    ChartNode current = nodesById.get(descendantId);
    while (current != null && current.getParentId() != null && visited.add(current.getId())) {
      if (current.getParentId().equals(ancestorId)) {
        return true;
      }
      current = nodesById.get(current.getParentId());
    }
    return false;
  }

  /**
   * Number of ancestors; top-level and unknown nodes are at depth 0.
   */
  public static int depth(final String nodeId, final Collection<? extends ChartNode> nodes) {
    return depth(nodeId, ChartPaths.index(nodes));
  }

  static int depth(final String nodeId, final Map<String, ChartNode> nodesById) {
    final Set<String> visited = new HashSet<>();
    int depth = 0;
    ChartNode current = nodesById.get(nodeId);
    while (current != null && current.getParentId() != null && visited.add(current.getId())) {
      current = nodesById.get(current.getParentId());
      if (current != null) {
        depth++;
      }
    }
    return depth;
  }

  /**
   * The base label if no sibling uses it, else the first free of "base 2", "base 3", ...
   */
  public static String uniqueLabel(final String baseLabel, final String parentId,
      final Collection<? extends ChartNode> nodes) {
    final Set<String> taken = new HashSet<>();
    for (final ChartNode node : nodes) {
      if (parentId == null ? node.getParentId() == null : parentId.equals(node.getParentId())) {
        taken.add(node.getLabel().trim());
      }
    }
    String label = baseLabel;
    int counter = 1;
    while (taken.contains(label.trim())) {
      counter++;
      label = baseLabel + " " + counter;
    }
    return label;
  }

  static void validateLabel(final String label) throws StatechartException {
    if (label == null || label.trim().isEmpty() || label.contains(ChartPaths.SEPARATOR)
        || label.startsWith(ChartPaths.DECISION_PREFIX) || label.equals(ChartPaths.SELF)
        || label.equals(ChartPaths.UP)) {
      throw new StatechartException(Code.INVALID_LABEL, "Illegal label: \"" + label + "\"");
    }
  }

  private static void requireFreeLabel(final List<ChartNode> nodes, final String label,
      final String parentId, final String exceptId) throws StatechartException {
    for (final ChartNode sibling : nodes) {
      final boolean sameScope = parentId == null ? sibling.getParentId() == null
          : parentId.equals(sibling.getParentId());
      if (sameScope && sibling.getKind() != NodeKind.PROXY && !sibling.getId().equals(exceptId)
          && sibling.getLabel().equals(label)) {
        throw new StatechartException(Code.DUPLICATE_LABEL,
            "Label \"" + label + "\" is already used by " + sibling.getId());
      }
    }
  }

  /**
   * Decisions are referenced as {@code @Name} from anywhere in the document, so a decision name
   * is unique across the whole chart, not just among siblings.
   */
  private static void requireFreeDecisionName(final List<ChartNode> nodes, final String label,
      final String exceptId) throws StatechartException {
    for (final ChartNode other : nodes) {
      if (other.getKind() == NodeKind.DECISION && !other.getId().equals(exceptId)
          && other.getLabel().equals(label)) {
        throw new StatechartException(Code.DUPLICATE_LABEL,
            "Decision name \"" + label + "\" is already used by " + other.getId());
      }
    }
  }

  private static ChartNode require(final Chart chart, final String nodeId)
      throws StatechartException {
    final ChartNode node = chart.findNode(nodeId);
    if (node == null) {
      throw new StatechartException(Code.UNKNOWN_NODE, "No node with id " + nodeId);
    }
    return node;
  }

  private static void refreshProxyPaths(final List<ChartNode> nodes) {
    final Map<String, ChartNode> nodesById = ChartPaths.index(nodes);
    for (final ChartNode node : nodes) {
      if (node instanceof ProxyNode) {
        final ProxyNode proxy = (ProxyNode) node;
        if (nodesById.containsKey(proxy.getTargetId())) {
          proxy.setTargetPath(ChartPaths.absolutePath(proxy.getTargetId(), nodesById));
        }
      }
    }
  }

  private ChartEdits() {}
}
