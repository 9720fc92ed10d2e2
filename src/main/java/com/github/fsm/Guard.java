package com.github.fsm;

/**
 * Predicate gating a transition. Returning false blocks the transition and the trigger fails with
 * {@link GuardRejectedException}.
 */
@FunctionalInterface
public interface Guard<S, E> {

  boolean allow(final TriggerContext context, final S fromState, final S toState, final E event);

}
