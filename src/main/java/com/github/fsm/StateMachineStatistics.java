package com.github.fsm;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Holder of trigger statistics for a single machine. Counters are updated by the machine itself
 * and are safe to read from any thread.
 */
public final class StateMachineStatistics {
  private final String stateMachineId;
  private final long startTstampMillis = System.currentTimeMillis();

  private final AtomicLong totalTriggers = new AtomicLong();
  private final AtomicLong transitionSuccesses = new AtomicLong();
  private final AtomicLong noTransitionFailures = new AtomicLong();
  private final AtomicLong guardRejections = new AtomicLong();

  StateMachineStatistics(final String stateMachineId) {
    this.stateMachineId = stateMachineId;
  }

  void triggered() {
    totalTriggers.incrementAndGet();
  }

  void transitioned() {
    transitionSuccesses.incrementAndGet();
  }

  void noTransition() {
    noTransitionFailures.incrementAndGet();
  }

  void guardRejected() {
    guardRejections.incrementAndGet();
  }

  public String getMachineId() {
    return stateMachineId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getTotalTriggers() {
    return totalTriggers.get();
  }

  public long getTransitionSuccesses() {
    return transitionSuccesses.get();
  }

  public long getNoTransitionFailures() {
    return noTransitionFailures.get();
  }

  public long getGuardRejections() {
    return guardRejections.get();
  }

  @Override
  public String toString() {
    return "StateMachineStatistics [stateMachineId=" + stateMachineId + ", startTstampMillis="
        + startTstampMillis + ", totalTriggers=" + totalTriggers + ", transitionSuccesses="
        + transitionSuccesses + ", noTransitionFailures=" + noTransitionFailures
        + ", guardRejections=" + guardRejections + "]";
  }

}
