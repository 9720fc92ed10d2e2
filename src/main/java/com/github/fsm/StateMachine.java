package com.github.fsm;

/**
 * A simple Finite State Machine that owns its current state.
 * 
 * Notes for users:<br>
 * 1. this FSM instance is thread-safe; every trigger() holds the machine's write lock from the
 * table lookup through the after hooks, so triggers on one machine never interleave<br>
 * 
 * 2. guards and hooks run on the caller thread while that lock is held. A slow hook stalls every
 * other caller of the same machine. A guard or hook that triggers the machine it is invoked by
 * fails with REENTRANT_TRIGGER<br>
 * 
 * 3. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed. Machines built off the same
 * {@link StateMachineBuilder} share nothing mutable<br>
 * 
 * 4. a failed trigger leaves the current state untouched<br>
 * 
 * Use {@link StateMachineBuilder} to build one. See {@link StatelessStateMachine} for the variant
 * that leaves current state tracking to the caller.
 */
public interface StateMachine<S, E> {

  /**
   * Fire event against the current state. On success the current state is the transition's
   * target; on failure it is unchanged.
   */
  void trigger(final TriggerContext context, final E event) throws StateMachineException;

  /**
   * Same as {@link #trigger(TriggerContext, Object)} with {@link TriggerContext#background()}.
   */
  void trigger(final E event) throws StateMachineException;

  /**
   * Read/report the current state of the state machine.
   */
  S readCurrentState() throws StateMachineException;

  /**
   * Read-only view of the states and transitions this machine was built with.
   */
  TransitionTable<S, E> getTransitionTable();

  /**
   * Reports the id of this StateMachine instance.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  StateMachineConfiguration getConfiguration();

  /**
   * Report statistics for this FSM.
   */
  StateMachineStatistics getStatistics();

}
