package com.github.fsm;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Event value that carries its own before/after callbacks as data. Equality is defined by the key
 * alone, so an instance loaded with callbacks finds the transition registered with a plain
 * {@code CallbackEvent.of(key)}, and only that particular instance gets its callbacks run.
 */
public final class CallbackEvent<K> implements BeforeTransitionEvent, AfterTransitionEvent {
  private final K key;
  private final Consumer<TriggerContext> before;
  private final Consumer<TriggerContext> after;

  public static <K> CallbackEvent<K> of(final K key) {
    return new CallbackEvent<>(key, null, null);
  }

  public CallbackEvent<K> onBefore(final Consumer<TriggerContext> before) {
    return new CallbackEvent<>(key, before, after);
  }

  public CallbackEvent<K> onAfter(final Consumer<TriggerContext> after) {
    return new CallbackEvent<>(key, before, after);
  }

  public K getKey() {
    return key;
  }

  @Override
  public void beforeTransition(final TriggerContext context) {
    if (before != null) {
      before.accept(context);
    }
  }

  @Override
  public void afterTransition(final TriggerContext context) {
    if (after != null) {
      after.accept(context);
    }
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(key);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CallbackEvent)) {
      return false;
    }
    return Objects.equals(key, ((CallbackEvent<?>) obj).key);
  }

  @Override
  public String toString() {
    return String.valueOf(key);
  }

  private CallbackEvent(final K key, final Consumer<TriggerContext> before,
      final Consumer<TriggerContext> after) {
    this.key = Objects.requireNonNull(key, "key");
    this.before = before;
    this.after = after;
  }

}
