package com.github.fsm;

/**
 * Factory for the stock transition options. Only one guard, one before hook and one after hook
 * can be attached to a transition; attaching the same kind twice keeps the last one.
 */
public final class TransitionOptions {

  public static <S, E> TransitionOption<S, E> withGuard(final Guard<S, E> guard) {
    return transition -> transition.guard(guard);
  }

  public static <S, E> TransitionOption<S, E> withBefore(final TransitionHook<S, E> before) {
    return transition -> transition.before(before);
  }

  public static <S, E> TransitionOption<S, E> withAfter(final TransitionHook<S, E> after) {
    return transition -> transition.after(after);
  }

  private TransitionOptions() {}

}
