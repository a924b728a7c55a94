package com.github.statechart;

import java.util.Objects;

/**
 * Geometry of an initial or history marker drawn inside a state (or the root).
 */
public final class Marker {
  private final Point position;
  private final double size;

  private Marker(Point position, double size) {
    this.position = position;
    this.size = size;
  }

  public Point getPosition() {
    return position;
  }

  public double getSize() {
    return size;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Marker)) {
      return false;
    }
    Marker marker = (Marker) o;
    return Double.compare(size, marker.size) == 0 && Objects.equals(position, marker.position);
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, size);
  }

  @Override
  public String toString() {
    return "Marker [position=" + position + ", size=" + size + "]";
  }

  public static Marker of(Point position, double size) {
    return new Marker(position, size);
  }
}
