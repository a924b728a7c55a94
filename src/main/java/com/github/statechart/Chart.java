package com.github.statechart;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One snapshot of the editable graph: the flat node forest, the transition edges, the root
 * history flag and the machine properties. The lists are unmodifiable; operations that change a
 * chart hand back a new one.
 */
public final class Chart {
  private final List<ChartNode> nodes;
  private final List<Transition> edges;
  private final boolean rootHistory;
  private final MachineProperties properties;

  // K=node.id, V=node; built once, snapshot never changes
  private final Map<String, ChartNode> nodesById;

  public Chart(final Collection<? extends ChartNode> nodes, final Collection<Transition> edges,
      final boolean rootHistory, final MachineProperties properties) {
    this.nodes = Collections.unmodifiableList(
        nodes == null ? new ArrayList<ChartNode>() : new ArrayList<ChartNode>(nodes));
    this.edges = Collections.unmodifiableList(
        edges == null ? new ArrayList<Transition>() : new ArrayList<Transition>(edges));
    this.rootHistory = rootHistory;
    this.properties = properties == null ? new MachineProperties() : properties;
    final Map<String, ChartNode> index = new LinkedHashMap<>();
    for (final ChartNode node : this.nodes) {
      index.put(node.getId(), node);
    }
    this.nodesById = Collections.unmodifiableMap(index);
  }

  public static Chart empty() {
    return new Chart(null, null, false, null);
  }

  public List<ChartNode> getNodes() {
    return nodes;
  }

  public List<Transition> getEdges() {
    return edges;
  }

  public boolean isRootHistory() {
    return rootHistory;
  }

  public MachineProperties getProperties() {
    return properties;
  }

  public ChartNode findNode(final String nodeId) {
    return nodeId == null ? null : nodesById.get(nodeId);
  }

  /**
   * Direct children of the given node in document order; null asks for the forest roots.
   */
  public List<ChartNode> childrenOf(final String parentId) {
    final List<ChartNode> children = new ArrayList<>();
    for (final ChartNode node : nodes) {
      if (parentId == null ? node.getParentId() == null : parentId.equals(node.getParentId())) {
        children.add(node);
      }
    }
    return children;
  }

  /**
   * Deep copy, for operations that must not touch the caller's instances.
   */
  public Chart copy() {
    final List<ChartNode> nodeCopies = new ArrayList<>(nodes.size());
    for (final ChartNode node : nodes) {
      nodeCopies.add(node.copy());
    }
    final List<Transition> edgeCopies = new ArrayList<>(edges.size());
    for (final Transition edge : edges) {
      edgeCopies.add(edge.copy());
    }
    return new Chart(nodeCopies, edgeCopies, rootHistory, properties.copy());
  }

  @Override
  public String toString() {
    return "Chart [nodes=" + nodes.size() + ", edges=" + edges.size() + ", rootHistory="
        + rootHistory + "]";
  }
}
