package com.github.fsm;

/**
 * Thrown when the guard attached to a transition evaluated to false.
 */
public final class GuardRejectedException extends StateMachineException {
  private static final long serialVersionUID = 1L;
  private final transient Object fromState;
  private final transient Object toState;
  private final transient Object event;

  public GuardRejectedException(final Object fromState, final Object toState,
      final Object event) {
    super(Code.GUARD_REJECTED, String.format(
        "Guard condition not met (from: %s, to: %s, event: %s)", fromState, toState, event));
    this.fromState = fromState;
    this.toState = toState;
    this.event = event;
  }

  public Object getFromState() {
    return fromState;
  }

  public Object getToState() {
    return toState;
  }

  public Object getEvent() {
    return event;
  }
}
