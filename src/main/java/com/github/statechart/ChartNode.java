package com.github.statechart;

import java.util.Objects;

/**
 * A node of the chart's flat forest. Nesting is expressed only through {@link #getParentId()};
 * labels are unique among siblings, ids are unique within a snapshot.
 */
public abstract class ChartNode {
  private final String id;
  private String label;
  private String parentId; // null for forest roots
  private Bounds bounds; // optional

  protected ChartNode(final String id, final String label, final String parentId) {
    this.id = Objects.requireNonNull(id, "id");
    this.label = label == null ? "" : label;
    this.parentId = parentId;
  }

  public abstract NodeKind getKind();

  /**
   * Deep enough copy that mutating the copy never touches this node.
   */
  public abstract ChartNode copy();

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(final String label) {
    this.label = label == null ? "" : label;
  }

  public String getParentId() {
    return parentId;
  }

  public void setParentId(final String parentId) {
    this.parentId = parentId;
  }

  public boolean isTopLevel() {
    return parentId == null;
  }

  public Bounds getBounds() {
    return bounds;
  }

  public void setBounds(final Bounds bounds) {
    this.bounds = bounds;
  }

  protected <T extends ChartNode> T copyBaseInto(final T target) {
    target.setBounds(bounds);
    return target;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + id.hashCode();
    result = prime * result + getKind().hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    ChartNode other = (ChartNode) obj;
    return id.equals(other.id);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + " [id=" + id + ", label=" + label + ", parentId="
        + parentId + "]";
  }
}
