package com.github.statechart;

import com.github.statechart.StatechartException.Code;

/**
 * A directed edge between two nodes of the chart. Guard and action are opaque code fragments.
 */
public final class Transition {
  private final String id;
  private final String sourceId;
  private final String targetId;
  private String guard = "";
  private String action = "";
  private EdgeGeometry geometry; // optional

  public Transition(final String id, final String sourceId, final String targetId)
      throws StatechartException {
    if (id == null || sourceId == null || targetId == null) {
      throw new StatechartException(Code.INVALID_CHART,
          "Transition id, source and target are required: " + id + "," + sourceId + "->"
              + targetId);
    }
    this.id = id;
    this.sourceId = sourceId;
    this.targetId = targetId;
  }

  public Transition(final String id, final String sourceId, final String targetId,
      final String guard, final String action) throws StatechartException {
    this(id, sourceId, targetId);
    setGuard(guard);
    setAction(action);
  }

  private Transition(final Transition other) {
    this.id = other.id;
    this.sourceId = other.sourceId;
    this.targetId = other.targetId;
    this.guard = other.guard;
    this.action = other.action;
    this.geometry = other.geometry;
  }

  public Transition copy() {
    return new Transition(this);
  }

  public String getId() {
    return id;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getTargetId() {
    return targetId;
  }

  public String getGuard() {
    return guard;
  }

  public void setGuard(final String guard) {
    this.guard = guard == null ? "" : guard;
  }

  public String getAction() {
    return action;
  }

  public void setAction(final String action) {
    this.action = action == null ? "" : action;
  }

  public EdgeGeometry getGeometry() {
    return geometry;
  }

  public void setGeometry(final EdgeGeometry geometry) {
    this.geometry = geometry;
  }

  @Override
  public String toString() {
    return "Transition [id=" + id + ", sourceId=" + sourceId + ", targetId=" + targetId
        + ", guard=" + guard + ", action=" + action + "]";
  }
}
