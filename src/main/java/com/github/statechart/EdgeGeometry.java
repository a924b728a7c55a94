package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rendering-only geometry of a transition. None of it affects machine semantics.
 */
public final class EdgeGeometry {
  private final String sourceHandle;
  private final String targetHandle;
  private final List<Point> controlPoints;
  private final Double labelPosition;

  public EdgeGeometry(final String sourceHandle, final String targetHandle,
      final List<Point> controlPoints, final Double labelPosition) {
    this.sourceHandle = sourceHandle;
    this.targetHandle = targetHandle;
    this.controlPoints = controlPoints == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(controlPoints));
    this.labelPosition = labelPosition;
  }

  public String getSourceHandle() {
    return sourceHandle;
  }

  public String getTargetHandle() {
    return targetHandle;
  }

  public List<Point> getControlPoints() {
    return controlPoints;
  }

  public Double getLabelPosition() {
    return labelPosition;
  }

  /**
   * True iff there is anything worth persisting.
   */
  public boolean isEmpty() {
    return isBlank(sourceHandle) && isBlank(targetHandle) && controlPoints.isEmpty()
        && labelPosition == null;
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EdgeGeometry)) {
      return false;
    }
    EdgeGeometry other = (EdgeGeometry) o;
    return Objects.equals(sourceHandle, other.sourceHandle)
        && Objects.equals(targetHandle, other.targetHandle)
        && Objects.equals(controlPoints, other.controlPoints)
        && Objects.equals(labelPosition, other.labelPosition);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceHandle, targetHandle, controlPoints, labelPosition);
  }

  @Override
  public String toString() {
    return "EdgeGeometry [sourceHandle=" + sourceHandle + ", targetHandle=" + targetHandle
        + ", controlPoints=" + controlPoints + ", labelPosition=" + labelPosition + "]";
  }
}
