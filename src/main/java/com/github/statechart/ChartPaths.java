package com.github.statechart;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Path arithmetic over the node forest. Labels are unique only among siblings, so every reference
 * in a document is a path: absolute from the forest root, or relative to the referring state.
 *
 * Reference syntax understood by {@link #resolve(String, String)}:<br>
 * {@code .} the source itself<br>
 * {@code ./X/Y} a descendant of the source<br>
 * {@code ..}, {@code ../..}, {@code ../X} ascent from the source, optionally followed by descent<br>
 * {@code X} or {@code X/Y} a name in the source's sibling scope<br>
 * {@code /X/Y} absolute from the forest root<br>
 * {@code @Name} decision indirection; not a path, see {@link #decisionName(String)}<br>
 *
 * Paths with no common ancestor are written absolute, see {@link #relativePath(String, String)}.
 */
public final class ChartPaths {
  static final String SEPARATOR = "/";
  static final String SELF = ".";
  static final String UP = "..";
  static final String DECISION_PREFIX = "@";

  /**
   * Absolute path of a node: ancestor labels from the forest root, joined by "/". A parent chain
   * that is broken or cyclic stops at the last reachable node.
   */
  public static String absolutePath(final String nodeId, final Map<String, ChartNode> nodesById) {
    ChartNode current = nodesById.get(nodeId);
    if (current == null) {
      return "";
    }
    final List<String> labels = new ArrayList<>();
    final Set<String> visited = new HashSet<>();
    while (current != null && visited.add(current.getId())) {
      labels.add(current.getLabel());
      current = current.getParentId() == null ? null : nodesById.get(current.getParentId());
    }
    final StringBuilder path = new StringBuilder();
    for (int iter = labels.size() - 1; iter >= 0; iter--) {
      path.append(labels.get(iter));
      if (iter > 0) {
        path.append(SEPARATOR);
      }
    }
    return path.toString();
  }

  public static String absolutePath(final String nodeId, final Chart chart) {
    return absolutePath(nodeId, index(chart.getNodes()));
  }

  /**
   * K=node.id, V=absolute path, for every node given.
   */
  public static Map<String, String> pathsById(final Collection<? extends ChartNode> nodes) {
    final Map<String, ChartNode> nodesById = index(nodes);
    final Map<String, String> paths = new LinkedHashMap<>();
    for (final ChartNode node : nodes) {
      paths.put(node.getId(), absolutePath(node.getId(), nodesById));
    }
    return paths;
  }

  /**
   * Shortest reference from the state at sourcePath to the state at targetPath, in priority
   * order: self, descendant, sibling, then ups and downs over the longest common prefix. When the
   * two paths share no leading segment the target's absolute form is returned instead of climbing
   * to the forest root. An empty sourcePath stands for the forest root itself, from which every
   * absolute path reads as a sibling-scope name.
   */
  public static String relativePath(final String sourcePath, final String targetPath) {
    if (sourcePath.equals(targetPath)) {
      return SELF;
    }
    if (sourcePath.isEmpty()) {
      return targetPath;
    }
    if (targetPath.startsWith(sourcePath + SEPARATOR)) {
      return SELF + SEPARATOR + targetPath.substring(sourcePath.length() + 1);
    }

    final String[] sourceParts = segments(sourcePath);
    final String[] targetParts = segments(targetPath);
    if (parentOf(sourceParts).equals(parentOf(targetParts))) {
      return targetParts[targetParts.length - 1];
    }

    int commonLength = 0;
    final int minLength = Math.min(sourceParts.length, targetParts.length);
    while (commonLength < minLength && sourceParts[commonLength].equals(targetParts[commonLength])) {
      commonLength++;
    }
    if (commonLength == 0) {
      return SEPARATOR + targetPath;
    }

    final StringBuilder reference = new StringBuilder();
    for (int up = 0; up < sourceParts.length - commonLength; up++) {
      if (up > 0) {
        reference.append(SEPARATOR);
      }
      reference.append(UP);
    }
    for (int down = commonLength; down < targetParts.length; down++) {
      reference.append(SEPARATOR).append(targetParts[down]);
    }
    return reference.toString();
  }

  /**
   * Inverse of {@link #relativePath(String, String)}: turns a path reference written in the
   * context of sourcePath into an absolute path. Total; a reference that climbs above the forest
   * root is clamped to it. Decision references must be handled before calling this.
   */
  public static String resolve(final String reference, final String sourcePath) {
    if (reference.startsWith(SEPARATOR)) {
      return reference.substring(1);
    }
    if (reference.equals(SELF)) {
      return sourcePath;
    }
    if (reference.startsWith(SELF + SEPARATOR)) {
      return join(sourcePath, reference.substring(2));
    }

    final String[] referenceParts = reference.split(SEPARATOR, -1);
    if (referenceParts[0].equals(UP)) {
      final String[] sourceParts = segments(sourcePath);
      int depth = sourceParts.length;
      int iter = 0;
      while (iter < referenceParts.length && referenceParts[iter].equals(UP)) {
        depth--;
        iter++;
      }
      depth = Math.max(depth, 0);
      final List<String> parts = new ArrayList<>(Arrays.asList(sourceParts).subList(0, depth));
      parts.addAll(Arrays.asList(referenceParts).subList(iter, referenceParts.length));
      return String.join(SEPARATOR, parts);
    }

    // sibling scope
    return join(parentOf(segments(sourcePath)), reference);
  }

  public static boolean isDecisionReference(final String reference) {
    return reference.startsWith(DECISION_PREFIX);
  }

  public static String decisionReference(final String decisionLabel) {
    return DECISION_PREFIX + decisionLabel;
  }

  public static String decisionName(final String reference) {
    return reference.substring(DECISION_PREFIX.length());
  }

  static String join(final String parentPath, final String child) {
    return parentPath.isEmpty() ? child : parentPath + SEPARATOR + child;
  }

  static Map<String, ChartNode> index(final Collection<? extends ChartNode> nodes) {
    final Map<String, ChartNode> nodesById = new HashMap<>();
    for (final ChartNode node : nodes) {
      nodesById.put(node.getId(), node);
    }
    return nodesById;
  }

  private static String[] segments(final String path) {
    return path.isEmpty() ? new String[0] : path.split(SEPARATOR, -1);
  }

  private static String parentOf(final String[] parts) {
    return parts.length <= 1 ? "" : String.join(SEPARATOR, Arrays.copyOf(parts, parts.length - 1));
  }

  private ChartPaths() {}
}
