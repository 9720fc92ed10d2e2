package com.github.fsm;

/**
 * A Finite State Machine that holds no current state of its own; callers pass it in and get the
 * next state back. Instances are immutable after build and may be shared freely across threads.
 */
public interface StatelessStateMachine<S, E> {

  /**
   * Evaluate event against currentState and return the state the machine moves to.
   */
  S trigger(final TriggerContext context, final S currentState, final E event)
      throws StateMachineException;

  /**
   * Same as {@link #trigger(TriggerContext, Object, Object)} with
   * {@link TriggerContext#background()}.
   */
  S trigger(final S currentState, final E event) throws StateMachineException;

  TransitionTable<S, E> getTransitionTable();

  String getId();

  StateMachineStatistics getStatistics();

}
