package com.github.fsm;

/**
 * Thrown when the transition table has no entry for the (state, event) pair presented to
 * trigger. State and event are kept as plain objects since generic classes are not permitted to
 * extend Throwable.
 */
public final class NoTransitionException extends StateMachineException {
  private static final long serialVersionUID = 1L;
  private final transient Object fromState;
  private final transient Object event;

  public NoTransitionException(final Object fromState, final Object event) {
    super(Code.NO_TRANSITION, String.format("No transition found (from: %s, event: %s)",
        fromState, event));
    this.fromState = fromState;
    this.event = event;
  }

  public Object getFromState() {
    return fromState;
  }

  public Object getEvent() {
    return event;
  }
}
