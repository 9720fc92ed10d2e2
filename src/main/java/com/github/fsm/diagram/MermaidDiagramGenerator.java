package com.github.fsm.diagram;

/**
 * Mermaid state diagram. The current state is marked with a [*] label.
 */
public final class MermaidDiagramGenerator extends AbstractDiagramGenerator {

  @Override
  void header(final StringBuilder builder) {
    builder.append("stateDiagram-v2\n");
  }

  @Override
  void state(final StringBuilder builder, final String state, final boolean current) {
    if (current) {
      builder.append(String.format("    %s : [*] %s\n", state, state));
    } else {
      builder.append(String.format("    %s\n", state));
    }
  }

  @Override
  void edge(final StringBuilder builder, final String from, final String to, final String event) {
    builder.append(String.format("    %s --> %s : %s\n", from, to, event));
  }

  @Override
  void footer(final StringBuilder builder) {}

}
