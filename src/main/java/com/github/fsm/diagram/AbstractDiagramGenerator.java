package com.github.fsm.diagram;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Takes care of ordering: states sorted ascending, edges sorted by (from, to, event). Subclasses
 * only decide how each line looks.
 */
abstract class AbstractDiagramGenerator implements DiagramGenerator {
  private static final Comparator<Edge> edgeOrder = Comparator.comparing((Edge edge) -> edge.from)
      .thenComparing(edge -> edge.to).thenComparing(edge -> edge.event);

  @Override
  public final String generate(final Set<String> states,
      final Map<String, Map<String, String>> transitions, final String currentState) {
    final StringBuilder builder = new StringBuilder();
    header(builder);

    final List<String> sortedStates = new ArrayList<>(states);
    Collections.sort(sortedStates);
    for (final String state : sortedStates) {
      state(builder, state, state.equals(currentState));
    }

    final List<Edge> sortedEdges = new ArrayList<>();
    for (final Map.Entry<String, Map<String, String>> from : transitions.entrySet()) {
      for (final Map.Entry<String, String> byEvent : from.getValue().entrySet()) {
        sortedEdges.add(new Edge(from.getKey(), byEvent.getValue(), byEvent.getKey()));
      }
    }
    Collections.sort(sortedEdges, edgeOrder);
    for (final Edge edge : sortedEdges) {
      edge(builder, edge.from, edge.to, edge.event);
    }

    footer(builder);
    return builder.toString();
  }

  abstract void header(final StringBuilder builder);

  abstract void state(final StringBuilder builder, final String state, final boolean current);

  abstract void edge(final StringBuilder builder, final String from, final String to,
      final String event);

  abstract void footer(final StringBuilder builder);

  private static final class Edge {
    private final String from;
    private final String to;
    private final String event;

    private Edge(final String from, final String to, final String event) {
      this.from = from;
      this.to = to;
      this.event = event;
    }
  }

}
