package com.github.fsm;

/**
 * Side effect run right before or right after a transition commits. Hooks have no failure channel;
 * anything they throw reaches the caller of trigger untouched.
 */
@FunctionalInterface
public interface TransitionHook<S, E> {

  void onTransition(final TriggerContext context, final S fromState, final S toState,
      final E event);

}
