package com.github.statechart;

/**
 * Branching pseudo-state. It has no actions and no path of its own: transitions leaving it are
 * resolved from its parent state's path, and transitions entering it refer to it by bare label.
 */
public final class DecisionNode extends ChartNode {

  public DecisionNode(final String id, final String label, final String parentId) {
    super(id, label, parentId);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DECISION;
  }

  @Override
  public DecisionNode copy() {
    return copyBaseInto(new DecisionNode(getId(), getLabel(), getParentId()));
  }
}
