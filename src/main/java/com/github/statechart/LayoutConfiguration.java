package com.github.statechart;

/**
 * This class encapsulates the auto-layout parameters used when a document carries no saved
 * geometry. Use the {@code LayoutConfigurationBuilder} to build it; every knob not set keeps the
 * default the editor has always used.
 *
 * Notes:<br>
 * 1. top-level states are tiled left to right starting at the top-level origin; children are
 * tiled left to right inside their parent starting at the child origin, below the header.<br>
 * 2. a state without saved geometry grows to enclose its children plus padding, never below the
 * default size.<br>
 * 3. decisions are laid out after the states of the same scope, on the same row.<br>
 */
public final class LayoutConfiguration {
  private final double defaultWidth;
  private final double defaultHeight;
  private final double defaultDecisionSize;
  private final double horizontalGap;
  private final Point topLevelOrigin;
  private final Point childOrigin;
  private final double paddingRight;
  private final double paddingBottom;
  private final double historyMarkerOffsetRatio;
  private final double historyMarkerSizeRatio;
  private final Marker rootHistoryMarker;

  public static LayoutConfiguration defaults() {
    return new LayoutConfiguration(LayoutConfigurationBuilder.newBuilder());
  }

  public double getDefaultWidth() {
    return defaultWidth;
  }

  public double getDefaultHeight() {
    return defaultHeight;
  }

  public double getDefaultDecisionSize() {
    return defaultDecisionSize;
  }

  public double getHorizontalGap() {
    return horizontalGap;
  }

  public Point getTopLevelOrigin() {
    return topLevelOrigin;
  }

  public Point getChildOrigin() {
    return childOrigin;
  }

  public double getPaddingRight() {
    return paddingRight;
  }

  public double getPaddingBottom() {
    return paddingBottom;
  }

  /**
   * Default history marker of a state with the given size.
   */
  public Marker historyMarkerFor(final double width, final double height) {
    return Marker.of(Point.of(width * historyMarkerOffsetRatio, height * historyMarkerOffsetRatio),
        Math.min(width, height) * historyMarkerSizeRatio);
  }

  public Marker getRootHistoryMarker() {
    return rootHistoryMarker;
  }

  public final static class LayoutConfigurationBuilder {
    private double defaultWidth = 150;
    private double defaultHeight = 50;
    private double defaultDecisionSize = 15;
    private double horizontalGap = 50;
    private Point topLevelOrigin = Point.of(50, 50);
    private Point childOrigin = Point.of(20, 40);
    private double paddingRight = 40;
    private double paddingBottom = 20;
    private double historyMarkerOffsetRatio = 0.05;
    private double historyMarkerSizeRatio = 0.15;
    private Marker rootHistoryMarker = Marker.of(Point.of(20, 20), 20);

    public static LayoutConfigurationBuilder newBuilder() {
      return new LayoutConfigurationBuilder();
    }

    public LayoutConfigurationBuilder defaultStateSize(double width, double height) {
      this.defaultWidth = width;
      this.defaultHeight = height;
      return this;
    }

    public LayoutConfigurationBuilder defaultDecisionSize(double defaultDecisionSize) {
      this.defaultDecisionSize = defaultDecisionSize;
      return this;
    }

    public LayoutConfigurationBuilder horizontalGap(double horizontalGap) {
      this.horizontalGap = horizontalGap;
      return this;
    }

    public LayoutConfigurationBuilder topLevelOrigin(final Point topLevelOrigin) {
      this.topLevelOrigin = topLevelOrigin;
      return this;
    }

    public LayoutConfigurationBuilder childOrigin(final Point childOrigin) {
      this.childOrigin = childOrigin;
      return this;
    }

    public LayoutConfigurationBuilder padding(double right, double bottom) {
      this.paddingRight = right;
      this.paddingBottom = bottom;
      return this;
    }

    public LayoutConfigurationBuilder historyMarkerRatios(double offsetRatio, double sizeRatio) {
      this.historyMarkerOffsetRatio = offsetRatio;
      this.historyMarkerSizeRatio = sizeRatio;
      return this;
    }

    public LayoutConfigurationBuilder rootHistoryMarker(final Marker rootHistoryMarker) {
      this.rootHistoryMarker = rootHistoryMarker;
      return this;
    }

    public LayoutConfiguration build() throws StatechartException {
      validate();
      return new LayoutConfiguration(this);
    }

    private void validate() throws StatechartException {
      StringBuilder messages = new StringBuilder();
      if (defaultWidth <= 0 || defaultHeight <= 0) {
        messages.append("Default state size must be positive. ");
      }
      if (defaultDecisionSize <= 0) {
        messages.append("Default decision size must be positive. ");
      }
      if (horizontalGap < 0) {
        messages.append("Horizontal gap cannot be negative. ");
      }
      if (topLevelOrigin == null || childOrigin == null) {
        messages.append("Layout origins cannot be null. ");
      }
      if (paddingRight < 0 || paddingBottom < 0) {
        messages.append("Padding cannot be negative. ");
      }
      if (historyMarkerOffsetRatio < 0 || historyMarkerOffsetRatio > 1
          || historyMarkerSizeRatio <= 0 || historyMarkerSizeRatio > 1) {
        messages.append("History marker ratios must lie within (0, 1]. ");
      }
      if (rootHistoryMarker == null) {
        messages.append("Root history marker cannot be null. ");
      }
      if (messages.length() > 0) {
        throw new StatechartException(StatechartException.Code.INVALID_LAYOUT_CONFIG,
            messages.toString());
      }
    }

    private LayoutConfigurationBuilder() {}
  }

  @Override
  public String toString() {
    return "LayoutConfiguration [defaultWidth=" + defaultWidth + ", defaultHeight="
        + defaultHeight + ", defaultDecisionSize=" + defaultDecisionSize + ", horizontalGap="
        + horizontalGap + ", topLevelOrigin=" + topLevelOrigin + ", childOrigin=" + childOrigin
        + "]";
  }

  private LayoutConfiguration(final LayoutConfigurationBuilder builder) {
    this.defaultWidth = builder.defaultWidth;
    this.defaultHeight = builder.defaultHeight;
    this.defaultDecisionSize = builder.defaultDecisionSize;
    this.horizontalGap = builder.horizontalGap;
    this.topLevelOrigin = builder.topLevelOrigin;
    this.childOrigin = builder.childOrigin;
    this.paddingRight = builder.paddingRight;
    this.paddingBottom = builder.paddingBottom;
    this.historyMarkerOffsetRatio = builder.historyMarkerOffsetRatio;
    this.historyMarkerSizeRatio = builder.historyMarkerSizeRatio;
    this.rootHistoryMarker = builder.rootHistoryMarker;
  }

}
