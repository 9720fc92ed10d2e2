package com.github.fsm.diagram;

/**
 * Graphviz directed graph. The current state is drawn as a filled double circle.
 */
public final class DotDiagramGenerator extends AbstractDiagramGenerator {

  @Override
  void header(final StringBuilder builder) {
    builder.append("digraph StateMachine {\n");
  }

  @Override
  void state(final StringBuilder builder, final String state, final boolean current) {
    if (current) {
      builder.append(String.format(
          "    \"%s\" [shape=doublecircle, style=filled, fillcolor=lightblue];\n", state));
    } else {
      builder.append(String.format("    \"%s\" [shape=circle];\n", state));
    }
  }

  @Override
  void edge(final StringBuilder builder, final String from, final String to, final String event) {
    builder.append(String.format("    \"%s\" -> \"%s\" [label=\"%s\"];\n", from, to, event));
  }

  @Override
  void footer(final StringBuilder builder) {
    builder.append("}");
  }

}
