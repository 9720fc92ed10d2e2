package com.github.fsm;

/**
 * Capability an event value may expose to be notified once the machine committed the new state.
 * Checked against the runtime event instance on every trigger.
 */
public interface AfterTransitionEvent {

  void afterTransition(final TriggerContext context);

}
