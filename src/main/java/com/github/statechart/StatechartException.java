package com.github.statechart;

/**
 * Unified single exception that's thrown by the statechart codec and its edit operations. The
 * code enum encapsulates the various failure conditions; parser stack traces, where available,
 * are kept as the cause and not hidden from users.
 */
public final class StatechartException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StatechartException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StatechartException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StatechartException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    MALFORMED_DOCUMENT("Document text could not be parsed into a statechart"),
    // 2.
    INCONSISTENT_MODEL("Model has dangling id references"),
    // 3.
    UNKNOWN_NODE("No node exists with the provided id"),
    // 4.
    DUPLICATE_LABEL("Label is already used by a sibling state or decision"),
    // 5.
    INVALID_LABEL("Label cannot be empty, contain '/', start with '@' or be '.' or '..'"),
    // 6.
    ILLEGAL_MOVE("A node cannot be moved under itself or one of its descendants"),
    // 7.
    INVALID_LAYOUT_CONFIG("Layout configuration is invalid"),
    // 8.
    INVALID_CHART("Chart snapshot is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
