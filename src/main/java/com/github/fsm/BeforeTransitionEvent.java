package com.github.fsm;

/**
 * Capability an event value may expose to be notified after the guard passed and before the
 * machine commits the new state. Checked against the runtime event instance on every trigger.
 */
public interface BeforeTransitionEvent {

  void beforeTransition(final TriggerContext context);

}
