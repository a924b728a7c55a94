package com.github.statechart;

/**
 * Non-authoritative placeholder mirroring a real state elsewhere in the diagram. Transitions that
 * end on a proxy really end on its target; a proxy is never a transition source.
 */
public final class ProxyNode extends ChartNode {
  private String targetId;
  // cached absolute path of the target, for display
  private String targetPath = "";
  private boolean broken;

  public ProxyNode(final String id, final String label, final String parentId,
      final String targetId) {
    super(id, label, parentId);
    this.targetId = targetId;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PROXY;
  }

  @Override
  public ProxyNode copy() {
    final ProxyNode copy =
        copyBaseInto(new ProxyNode(getId(), getLabel(), getParentId(), targetId));
    copy.targetPath = targetPath;
    copy.broken = broken;
    return copy;
  }

  public String getTargetId() {
    return targetId;
  }

  public void setTargetId(final String targetId) {
    this.targetId = targetId;
  }

  public String getTargetPath() {
    return targetPath;
  }

  public void setTargetPath(final String targetPath) {
    this.targetPath = targetPath == null ? "" : targetPath;
  }

  public boolean isBroken() {
    return broken;
  }

  public void setBroken(final boolean broken) {
    this.broken = broken;
  }
}
