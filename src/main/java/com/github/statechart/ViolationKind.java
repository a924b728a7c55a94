package com.github.statechart;

/**
 * Classes of referential-integrity violation found by the {@link ConsistencyChecker}.
 */
public enum ViolationKind {
  // edge.sourceId names no node
  DANGLING_EDGE_SOURCE("dangling_edge_source"),
  // edge.targetId names no node
  DANGLING_EDGE_TARGET("dangling_edge_target"),
  // node.parentId names no node
  DANGLING_PARENT("dangling_parent"),
  // a proxy not marked broken whose targetId names no node
  BROKEN_PROXY_TARGET("broken_proxy_target"),
  // state.initial names no node
  DANGLING_INITIAL("dangling_initial");

  private final String tag;

  private ViolationKind(final String tag) {
    this.tag = tag;
  }

  public String getTag() {
    return tag;
  }
}
