package com.github.statechart;

/**
 * A real machine state. Action fields are opaque code fragments in the machine's language.
 */
public final class StateNode extends ChartNode {
  private String entry = "";
  private String exit = "";
  private String doAction = "";
  private String annotation = "";
  private boolean history;
  private boolean orthogonal;
  // id of the default child, must be a direct child
  private String initial;
  private Marker initialMarker;
  private Marker historyMarker;
  private boolean showAnnotation;
  private boolean showEntry;
  private boolean showDo;
  private boolean showExit;

  public StateNode(final String id, final String label, final String parentId) {
    super(id, label, parentId);
  }

  public StateNode(final String id, final String label) {
    this(id, label, null);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.STATE;
  }

  @Override
  public StateNode copy() {
    final StateNode copy = copyBaseInto(new StateNode(getId(), getLabel(), getParentId()));
    copy.entry = entry;
    copy.exit = exit;
    copy.doAction = doAction;
    copy.annotation = annotation;
    copy.history = history;
    copy.orthogonal = orthogonal;
    copy.initial = initial;
    copy.initialMarker = initialMarker;
    copy.historyMarker = historyMarker;
    copy.showAnnotation = showAnnotation;
    copy.showEntry = showEntry;
    copy.showDo = showDo;
    copy.showExit = showExit;
    return copy;
  }

  public String getEntry() {
    return entry;
  }

  public void setEntry(final String entry) {
    this.entry = entry == null ? "" : entry;
  }

  public String getExit() {
    return exit;
  }

  public void setExit(final String exit) {
    this.exit = exit == null ? "" : exit;
  }

  public String getDoAction() {
    return doAction;
  }

  public void setDoAction(final String doAction) {
    this.doAction = doAction == null ? "" : doAction;
  }

  public String getAnnotation() {
    return annotation;
  }

  public void setAnnotation(final String annotation) {
    this.annotation = annotation == null ? "" : annotation;
  }

  public boolean isHistory() {
    return history;
  }

  public void setHistory(final boolean history) {
    this.history = history;
  }

  public boolean isOrthogonal() {
    return orthogonal;
  }

  public void setOrthogonal(final boolean orthogonal) {
    this.orthogonal = orthogonal;
  }

  public String getInitial() {
    return initial;
  }

  public void setInitial(final String initial) {
    this.initial = initial;
  }

  public Marker getInitialMarker() {
    return initialMarker;
  }

  public void setInitialMarker(final Marker initialMarker) {
    this.initialMarker = initialMarker;
  }

  public Marker getHistoryMarker() {
    return historyMarker;
  }

  public void setHistoryMarker(final Marker historyMarker) {
    this.historyMarker = historyMarker;
  }

  public boolean isShowAnnotation() {
    return showAnnotation;
  }

  public void setShowAnnotation(final boolean showAnnotation) {
    this.showAnnotation = showAnnotation;
  }

  public boolean isShowEntry() {
    return showEntry;
  }

  public void setShowEntry(final boolean showEntry) {
    this.showEntry = showEntry;
  }

  public boolean isShowDo() {
    return showDo;
  }

  public void setShowDo(final boolean showDo) {
    this.showDo = showDo;
  }

  public boolean isShowExit() {
    return showExit;
  }

  public void setShowExit(final boolean showExit) {
    this.showExit = showExit;
  }
}
