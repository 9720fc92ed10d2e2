package com.github.fsm.diagram;

/**
 * Textual notations a transition table can be rendered to.
 */
public enum DiagramFormat {
  // mermaid stateDiagram-v2
  MERMAID,
  // graphviz digraph
  DOT;
}
