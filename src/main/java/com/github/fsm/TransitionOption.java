package com.github.fsm;

/**
 * Configuration knob applied to a transition while it is being registered. See
 * {@link TransitionOptions} for the stock ones.
 */
@FunctionalInterface
public interface TransitionOption<S, E> {

  void apply(final Transition.Builder<S, E> transition);

}
