package com.github.fsm;

import java.util.Objects;
import java.util.UUID;

/**
 * Lock-free machine: every trigger is a function of its arguments against the shared read-only
 * transition table.
 */
final class StatelessStateMachineImpl<S, E> implements StatelessStateMachine<S, E> {
  private final String machineId = UUID.randomUUID().toString();
  private final StateMachineStatistics machineStats = new StateMachineStatistics(machineId);
  private final TransitionEvaluator<S, E> evaluator;

  StatelessStateMachineImpl(final TransitionTable<S, E> transitionTable) {
    this.evaluator = new TransitionEvaluator<>(machineId, transitionTable, machineStats);
    TransitionEvaluator.logInfo(machineId,
        String.format("Built stateless state machine with %d states and %d transitions",
            transitionTable.stateCount(), transitionTable.transitionCount()));
  }

  @Override
  public S trigger(final TriggerContext context, final S currentState, final E event)
      throws StateMachineException {
    Objects.requireNonNull(context, "context");
    return evaluator.evaluate(context, currentState, event, nextState -> {
    });
  }

  @Override
  public S trigger(final S currentState, final E event) throws StateMachineException {
    return trigger(TriggerContext.background(), currentState, event);
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
  public StateMachineStatistics getStatistics() {
    return machineStats;
  }

  @Override
  public String toString() {
    return "StatelessStateMachine [machineId=" + machineId + "]";
  }

}
