package com.github.fsm.diagram;

import java.util.Map;
import java.util.Set;

/**
 * Renders states and transitions, already stringified, into a diagram. Output must be fully
 * deterministic for a given input since it gets diffed against stored reference text.
 */
public interface DiagramGenerator {

  /**
   * @param states all registered states
   * @param transitions K=fromState, V=(K=event, V=toState)
   * @param currentState the state to highlight
   */
  String generate(final Set<String> states, final Map<String, Map<String, String>> transitions,
      final String currentState);

}
