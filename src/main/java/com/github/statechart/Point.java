package com.github.statechart;

import java.util.Objects;

public final class Point {
  private final double x;
  private final double y;

  private Point(double x, double y) {
    this.x = x;
    this.y = y;
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    Point point = (Point) o;
    return Double.compare(x, point.x) == 0 && Double.compare(y, point.y) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(x, y);
  }

  @Override
  public String toString() {
    return "Point [x=" + x + ", y=" + y + "]";
  }

  public static Point of(double x, double y) {
    return new Point(x, y);
  }
}
