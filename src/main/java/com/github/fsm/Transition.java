package com.github.fsm;

import java.util.Objects;
import java.util.Optional;

/**
 * Immutable rule mapping a (fromState, event) pair to a toState along with its optional guard and
 * before/after hooks. Instances are assembled by {@link StateMachineBuilder} via
 * {@link Transition.Builder} and never change after registration.
 */
public final class Transition<S, E> {
  private final S fromState;
  private final S toState;
  private final E event;
  private final Guard<S, E> guard;
  private final TransitionHook<S, E> beforeHook;
  private final TransitionHook<S, E> afterHook;

  private Transition(final Builder<S, E> builder) {
    this.fromState = builder.fromState;
    this.toState = builder.toState;
    this.event = builder.event;
    this.guard = builder.guard;
    this.beforeHook = builder.beforeHook;
    this.afterHook = builder.afterHook;
  }

  public S getFromState() {
    return fromState;
  }

  public S getToState() {
    return toState;
  }

  public E getEvent() {
    return event;
  }

  public Optional<Guard<S, E>> getGuard() {
    return Optional.ofNullable(guard);
  }

  public Optional<TransitionHook<S, E>> getBeforeHook() {
    return Optional.ofNullable(beforeHook);
  }

  public Optional<TransitionHook<S, E>> getAfterHook() {
    return Optional.ofNullable(afterHook);
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState + ", toState=" + toState + ", event=" + event
        + ", guarded=" + (guard != null) + ", before=" + (beforeHook != null) + ", after="
        + (afterHook != null) + "]";
  }

  /**
   * Mutable accumulator handed to every {@link TransitionOption} during registration.
   */
  public final static class Builder<S, E> {
    private final S fromState;
    private final S toState;
    private final E event;
    private Guard<S, E> guard;
    private TransitionHook<S, E> beforeHook;
    private TransitionHook<S, E> afterHook;

    Builder(final S fromState, final S toState, final E event) {
      this.fromState = Objects.requireNonNull(fromState, "fromState");
      this.toState = Objects.requireNonNull(toState, "toState");
      this.event = Objects.requireNonNull(event, "event");
    }

    public Builder<S, E> guard(final Guard<S, E> guard) {
      this.guard = guard;
      return this;
    }

    public Builder<S, E> before(final TransitionHook<S, E> beforeHook) {
      this.beforeHook = beforeHook;
      return this;
    }

    public Builder<S, E> after(final TransitionHook<S, E> afterHook) {
      this.afterHook = afterHook;
      return this;
    }

    Transition<S, E> build() {
      return new Transition<>(this);
    }
  }

}
