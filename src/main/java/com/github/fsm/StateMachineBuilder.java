package com.github.fsm;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.github.fsm.StateMachineException.Code;

/**
 * A simple builder to let users use fluent APIs to build FSMs.
 *
 * Registering a second transition for the same (fromState, event) pair replaces the first one.
 * Transitions may reference states that were never registered with {@link #addState(Object)};
 * only the state set and the initial state are validated at build time.
 *
 * The builder can be built from any number of times. Every build snapshots the states and
 * transitions registered so far, so later changes to the builder do not leak into machines that
 * were already built.
 */
public final class StateMachineBuilder<S, E> {
  private final Set<S> states = new LinkedHashSet<>();
  // K=fromState, V=(K=event, V=transition)
  private final Map<S, Map<E, Transition<S, E>>> transitions = new LinkedHashMap<>();
  private StateMachineConfiguration config = StateMachineConfiguration.defaults();
  private S initialState;
  private boolean initialStateSet;

  public static <S, E> StateMachineBuilder<S, E> newBuilder() {
    return new StateMachineBuilder<>();
  }

  public StateMachineBuilder<S, E> addState(final S state) {
    states.add(Objects.requireNonNull(state, "state"));
    return this;
  }

  @SafeVarargs
  public final StateMachineBuilder<S, E> addStates(final S... states) {
    for (S state : states) {
      addState(state);
    }
    return this;
  }

  /**
   * Only consulted by {@link #build()}. Membership in the state set is checked at build time.
   */
  public StateMachineBuilder<S, E> initialState(final S initialState) {
    this.initialState = Objects.requireNonNull(initialState, "initialState");
    this.initialStateSet = true;
    return this;
  }

  @SafeVarargs
  public final StateMachineBuilder<S, E> addTransition(final S fromState, final S toState,
      final E event, final TransitionOption<S, E>... options) {
    final Transition.Builder<S, E> transition = new Transition.Builder<>(fromState, toState, event);
    for (TransitionOption<S, E> option : options) {
      if (option != null) {
        option.apply(transition);
      }
    }
    transitions.computeIfAbsent(fromState, from -> new LinkedHashMap<>()).put(event,
        transition.build());
    return this;
  }

  public StateMachineBuilder<S, E> config(final StateMachineConfiguration config) {
    this.config = Objects.requireNonNull(config, "config");
    return this;
  }

  /**
   * Builds a machine that tracks its own current state, seeded with the initial state.
   */
  public StateMachine<S, E> build() throws StateMachineException {
    validateStates();
    if (!initialStateSet) {
      throw new StateMachineException(Code.INITIAL_STATE_NOT_SET);
    }
    if (!states.contains(initialState)) {
      throw new StateMachineException(Code.INVALID_INITIAL_STATE,
          "Initial state must be one of the registered states, got: " + initialState);
    }
    return new StateMachineImpl<>(config, snapshot(), initialState);
  }

  /**
   * Builds a machine that expects the caller to supply the current state on every trigger. Any
   * initial state set on this builder is ignored.
   */
  public StatelessStateMachine<S, E> buildStateless() throws StateMachineException {
    validateStates();
    return new StatelessStateMachineImpl<>(snapshot());
  }

  private void validateStates() throws StateMachineException {
    if (states.isEmpty()) {
      throw new StateMachineException(Code.EMPTY_STATE_SET);
    }
  }

  private TransitionTable<S, E> snapshot() {
    return new TransitionTable<>(states, transitions);
  }

  private StateMachineBuilder() {}

}
