package com.github.fsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only snapshot of the registered states and transitions. K=fromState, V=(K=event,
 * V=transition). The table is fully hydrated at construction and never modified afterwards, so it
 * is safe to share between threads and between machines.
 * 
 * Note that the table does not require the from/to states of a transition to be registered
 * states.
 */
public final class TransitionTable<S, E> {
  private final Set<S> states;
  private final Map<S, Map<E, Transition<S, E>>> transitions;
  private final List<Transition<S, E>> allTransitions;

  TransitionTable(final Set<S> states, final Map<S, Map<E, Transition<S, E>>> transitions) {
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    final Map<S, Map<E, Transition<S, E>>> copy = new LinkedHashMap<>();
    final List<Transition<S, E>> flattened = new ArrayList<>();
    for (final Map.Entry<S, Map<E, Transition<S, E>>> entry : transitions.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
      flattened.addAll(entry.getValue().values());
    }
    this.transitions = Collections.unmodifiableMap(copy);
    this.allTransitions = Collections.unmodifiableList(flattened);
  }

  /**
   * Lookup the transition registered for the given state and event.
   */
  public Optional<Transition<S, E>> lookup(final S fromState, final E event) {
    final Map<E, Transition<S, E>> byEvent = transitions.get(fromState);
    if (byEvent == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(byEvent.get(event));
  }

  public Set<S> getStates() {
    return states;
  }

  public List<Transition<S, E>> getTransitions() {
    return allTransitions;
  }

  public boolean containsState(final S state) {
    return states.contains(state);
  }

  public int stateCount() {
    return states.size();
  }

  public int transitionCount() {
    return allTransitions.size();
  }

  @Override
  public String toString() {
    return "TransitionTable [states=" + states + ", transitions=" + allTransitions + "]";
  }

}
