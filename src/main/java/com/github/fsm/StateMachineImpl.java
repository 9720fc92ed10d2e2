package com.github.fsm;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.ReadLock;
import java.util.concurrent.locks.ReentrantReadWriteLock.WriteLock;

import com.github.fsm.StateMachineException.Code;

/**
 * A simple Finite State Machine owning a single current state cell.
 *
 * Notes:<br>
 * 1. the transition table is immutable and shared, currentState is the only mutable field and it
 * is only ever touched under machineSuperLock<br>
 *
 * 2. trigger() holds the write lock across lookup, guard, hooks and commit. There are no per-state
 * or per-event locks<br>
 *
 * 3. hooks that read the current state on the triggering thread see the fromState in before hooks
 * and the toState in after hooks since a writer may always take the read lock<br>
 *
 * 4. triggering the same machine from its own guards or hooks fails with REENTRANT_TRIGGER and
 * leaves the outer evaluation to carry on<br>
 */
final class StateMachineImpl<S, E> implements StateMachine<S, E> {
  private final String machineId = UUID.randomUUID().toString();

  private final StateMachineConfiguration config;
  private final StateMachineStatistics machineStats = new StateMachineStatistics(machineId);
  private final TransitionEvaluator<S, E> evaluator;

  // machine level locks
  private final ReentrantReadWriteLock machineSuperLock;
  private final WriteLock machineWriteLock;
  private final ReadLock machineReadLock;

  // guarded by machineSuperLock
  private S currentState;

  StateMachineImpl(final StateMachineConfiguration config,
      final TransitionTable<S, E> transitionTable, final S initialState) {
    this.config = config;
    this.machineSuperLock = new ReentrantReadWriteLock(config.isFairLock());
    this.machineWriteLock = machineSuperLock.writeLock();
    this.machineReadLock = machineSuperLock.readLock();
    this.evaluator = new TransitionEvaluator<>(machineId, transitionTable, machineStats);
    this.currentState = initialState;
    TransitionEvaluator.logInfo(machineId,
        String.format("Built state machine with %d states and %d transitions, initial state:%s, %s",
            transitionTable.stateCount(), transitionTable.transitionCount(), initialState,
            config));
  }

  @Override
  public void trigger(final TriggerContext context, final E event) throws StateMachineException {
    Objects.requireNonNull(context, "context");
    // the write lock is reentrant, a nested evaluation would commit under the outer one
    if (machineSuperLock.isWriteLockedByCurrentThread()) {
      TransitionEvaluator.logWarning(machineId,
          String.format("Rejected re-entrant trigger for event:%s", event));
      throw new StateMachineException(Code.REENTRANT_TRIGGER,
          "Re-entrant trigger for event " + event + " in state " + currentState);
    }
    acquire(machineWriteLock, "Timed out while trying to transition state machine");
    try {
      evaluator.evaluate(context, currentState, event, nextState -> currentState = nextState);
    } finally {
      machineWriteLock.unlock();
    }
  }

  @Override
  public void trigger(final E event) throws StateMachineException {
    trigger(TriggerContext.background(), event);
  }

  @Override
  public S readCurrentState() throws StateMachineException {
    acquire(machineReadLock, "Timed out while trying to read current state");
    try {
      return currentState;
    } finally {
      machineReadLock.unlock();
    }
  }

  @Override
  public TransitionTable<S, E> getTransitionTable() {
    return evaluator.getTransitionTable();
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public StateMachineConfiguration getConfiguration() {
    return config;
  }

  @Override
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  /**
   * Waits forever when no lockAcquisitionMillis is configured, else gives up after it elapses.
   */
  private void acquire(final Lock lock, final String timeoutMessage)
      throws StateMachineException {
    final long lockAcquisitionMillis = config.getLockAcquisitionMillis();
    try {
      if (lockAcquisitionMillis == 0L) {
        lock.lockInterruptibly();
      } else if (!lock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, timeoutMessage);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.INTERRUPTED, exception);
    }
  }

  @Override
  public String toString() {
    return "StateMachine [machineId=" + machineId + ", config=" + config + "]";
  }

}
