package com.github.fsm;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Execution context handed to every guard and hook invoked while servicing a trigger. It carries
 * cancellation, an optional deadline and request scoped values. The machine itself never looks at
 * any of these, it simply forwards the context unchanged.
 * 
 * Contexts form a chain: every derived context sees the cancellation, deadline and values of its
 * parent. Cancelling a context cancels everything derived from it but never its parent.
 */
public final class TriggerContext {
  private static final TriggerContext background = new TriggerContext(null, false, null, null,
      null);

  private final TriggerContext parent;
  private final boolean cancellable;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Instant deadline;
  private final Object key;
  private final Object value;

  /**
   * Root context that is never cancelled and has no deadline.
   */
  public static TriggerContext background() {
    return background;
  }

  /**
   * Fresh cancellable root context.
   */
  public static TriggerContext newContext() {
    return new TriggerContext(null, true, null, null, null);
  }

  public TriggerContext withDeadline(final Instant deadline) {
    if (deadline == null) {
      throw new IllegalArgumentException("Deadline cannot be null");
    }
    return new TriggerContext(this, true, deadline, null, null);
  }

  /**
   * Timeouts reaching past {@link Instant#MAX} are clamped to it.
   */
  public TriggerContext withTimeout(final Duration timeout) {
    if (timeout == null || timeout.isNegative()) {
      throw new IllegalArgumentException("Timeout cannot be null or negative");
    }
    final Instant now = Instant.now();
    if (timeout.compareTo(Duration.between(now, Instant.MAX)) >= 0) {
      return withDeadline(Instant.MAX);
    }
    return withDeadline(now.plus(timeout));
  }

  public TriggerContext withValue(final Object key, final Object value) {
    if (key == null) {
      throw new IllegalArgumentException("Key cannot be null");
    }
    return new TriggerContext(this, cancellable, null, key, value);
  }

  /**
   * Looks up the value bound to key by this context or the nearest ancestor.
   */
  public Optional<Object> getValue(final Object key) {
    for (TriggerContext context = this; context != null; context = context.parent) {
      if (context.key != null && context.key.equals(key)) {
        return Optional.ofNullable(context.value);
      }
    }
    return Optional.empty();
  }

  /**
   * Earliest deadline across this context and its ancestors.
   */
  public Optional<Instant> getDeadline() {
    Instant earliest = null;
    for (TriggerContext context = this; context != null; context = context.parent) {
      if (context.deadline != null && (earliest == null || context.deadline.isBefore(earliest))) {
        earliest = context.deadline;
      }
    }
    return Optional.ofNullable(earliest);
  }

  public boolean isExpired() {
    final Optional<Instant> deadline = getDeadline();
    return deadline.isPresent() && !Instant.now().isBefore(deadline.get());
  }

  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("Background context cannot be cancelled");
    }
    cancelled.set(true);
  }

  public boolean isCancelled() {
    for (TriggerContext context = this; context != null; context = context.parent) {
      if (context.cancelled.get()) {
        return true;
      }
    }
    return false;
  }

  /**
   * True when the context was cancelled or its deadline has passed.
   */
  public boolean isDone() {
    return isCancelled() || isExpired();
  }

  @Override
  public String toString() {
    return "TriggerContext [cancelled=" + isCancelled() + ", deadline=" + getDeadline().orElse(null)
        + "]";
  }

  private TriggerContext(final TriggerContext parent, final boolean cancellable,
      final Instant deadline, final Object key, final Object value) {
    this.parent = parent;
    this.cancellable = cancellable;
    this.deadline = deadline;
    this.key = key;
    this.value = value;
  }

}
