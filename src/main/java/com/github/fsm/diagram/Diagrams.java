package com.github.fsm.diagram;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.github.fsm.StateMachine;
import com.github.fsm.StateMachineException;
import com.github.fsm.StateMachineException.Code;
import com.github.fsm.Transition;
import com.github.fsm.TransitionTable;

/**
 * Entry point for rendering a machine's transition table. States and events are stringified with
 * {@link String#valueOf(Object)} before being handed to the generator for the requested format.
 *
 * Rendering works on those strings only: distinct states that stringify alike share one node, and
 * transitions from such states on events that stringify alike share one edge, the one registered
 * last. Give states and events distinct {@code toString()} values to keep them apart.
 */
public final class Diagrams {

  public static String generate(final TransitionTable<?, ?> table, final DiagramFormat format,
      final Object currentState) throws StateMachineException {
    final DiagramGenerator generator = generatorFor(format);

    final Set<String> states = new LinkedHashSet<>();
    for (final Object state : table.getStates()) {
      states.add(String.valueOf(state));
    }
    final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
    for (final Transition<?, ?> transition : table.getTransitions()) {
      transitions.computeIfAbsent(String.valueOf(transition.getFromState()),
          from -> new LinkedHashMap<>()).put(String.valueOf(transition.getEvent()),
              String.valueOf(transition.getToState()));
    }
    return generator.generate(states, transitions, String.valueOf(currentState));
  }

  /**
   * Renders the machine's table highlighting whatever state it is in right now.
   */
  public static String generate(final StateMachine<?, ?> stateMachine, final DiagramFormat format)
      throws StateMachineException {
    return generate(stateMachine.getTransitionTable(), format, stateMachine.readCurrentState());
  }

  public static DiagramGenerator generatorFor(final DiagramFormat format)
      throws StateMachineException {
    if (format == null) {
      throw new StateMachineException(Code.INVALID_DIAGRAM_FORMAT);
    }
    switch (format) {
      case MERMAID:
        return new MermaidDiagramGenerator();
      case DOT:
        return new DotDiagramGenerator();
      default:
        throw new StateMachineException(Code.INVALID_DIAGRAM_FORMAT,
            "Unsupported diagram format: " + format);
    }
  }

  private Diagrams() {}

}
