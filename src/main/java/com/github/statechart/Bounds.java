package com.github.statechart;

import java.util.Objects;

/**
 * Layout geometry of a node: position relative to its parent plus size. Decisions are square, so
 * their width and height are both the decision size.
 */
public final class Bounds {
  private final double x;
  private final double y;
  private final double width;
  private final double height;

  private Bounds(double x, double y, double width, double height) {
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getWidth() {
    return width;
  }

  public double getHeight() {
    return height;
  }

  public Bounds resize(double width, double height) {
    return new Bounds(x, y, width, height);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Bounds)) {
      return false;
    }
    Bounds other = (Bounds) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
        && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y, width, height);
  }

  @Override
  public String toString() {
    return "Bounds [x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
  }

  public static Bounds of(double x, double y, double width, double height) {
    return new Bounds(x, y, width, height);
  }

  public static Bounds square(double x, double y, double size) {
    return new Bounds(x, y, size, size);
  }
}
