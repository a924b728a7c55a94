package com.github.statechart;

import java.util.Objects;

public final class ConsistencyViolation {
  private final ViolationKind kind;
  private final String message;

  public ConsistencyViolation(final ViolationKind kind, final String message) {
    this.kind = kind;
    this.message = message;
  }

  public ViolationKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ConsistencyViolation)) {
      return false;
    }
    ConsistencyViolation other = (ConsistencyViolation) o;
    return kind == other.kind && Objects.equals(message, other.message);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, message);
  }

  @Override
  public String toString() {
    return "[" + kind.getTag() + "] " + message;
  }
}
