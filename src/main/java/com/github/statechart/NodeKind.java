package com.github.statechart;

/**
 * The kinds of node that live in a chart's flat node forest.
 */
public enum NodeKind {
  // a real machine state; may nest children, carries actions and flags
  STATE,
  // branching pseudo-state; hosts outgoing transitions only
  DECISION,
  // visual stand-in for a real state elsewhere in the diagram; forwards to its target
  PROXY;
}
