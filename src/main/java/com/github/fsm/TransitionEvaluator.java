package com.github.fsm;

import java.util.Optional;
import java.util.function.Consumer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The one trigger evaluation algorithm shared by the stateless and the stateful machine:
 *
 * 1. lookup the transition for (currentState, event), else fail with NO_TRANSITION<br>
 * 2. evaluate the guard, if any, else fail with GUARD_REJECTED<br>
 * 3. run the transition's before hook, then the event's own before capability<br>
 * 4. commit the target state<br>
 * 5. run the transition's after hook, then the event's own after capability<br>
 *
 * Steps 1 and 2 never mutate anything, so a rejected trigger leaves the machine exactly where it
 * was. Serializing evaluations is the caller's business.
 */
final class TransitionEvaluator<S, E> {
  private static final Logger logger =
      LogManager.getLogger(TransitionEvaluator.class.getSimpleName());

  private final String machineId;
  private final TransitionTable<S, E> transitionTable;
  private final StateMachineStatistics statistics;

  TransitionEvaluator(final String machineId, final TransitionTable<S, E> transitionTable,
      final StateMachineStatistics statistics) {
    this.machineId = machineId;
    this.transitionTable = transitionTable;
    this.statistics = statistics;
  }

  /**
   * Evaluates event against currentState and hands the target state to committer once guard and
   * before hooks are through. Returns the target state.
   */
  S evaluate(final TriggerContext context, final S currentState, final E event,
      final Consumer<S> committer) throws StateMachineException {
    statistics.triggered();
    final Optional<Transition<S, E>> found = transitionTable.lookup(currentState, event);
    if (!found.isPresent()) {
      statistics.noTransition();
      logWarning(machineId, String.format("No transition found for state:%s, event:%s",
          currentState, event));
      throw new NoTransitionException(currentState, event);
    }
    final Transition<S, E> transition = found.get();
    final S toState = transition.getToState();

    final Optional<Guard<S, E>> guard = transition.getGuard();
    if (guard.isPresent() && !guard.get().allow(context, currentState, toState, event)) {
      statistics.guardRejected();
      logWarning(machineId, String.format("Guard rejected transition from %s->%s on event:%s",
          currentState, toState, event));
      throw new GuardRejectedException(currentState, toState, event);
    }

    final Optional<TransitionHook<S, E>> before = transition.getBeforeHook();
    if (before.isPresent()) {
      before.get().onTransition(context, currentState, toState, event);
    }
    if (event instanceof BeforeTransitionEvent) {
      ((BeforeTransitionEvent) event).beforeTransition(context);
    }

    committer.accept(toState);
    statistics.transitioned();
    logDebug(machineId, String.format("Successfully transitioned from %s->%s on event:%s",
        currentState, toState, event));

    // the event's after capability runs even if the transition's after hook blows up
    try {
      final Optional<TransitionHook<S, E>> after = transition.getAfterHook();
      if (after.isPresent()) {
        after.get().onTransition(context, currentState, toState, event);
      }
    } finally {
      if (event instanceof AfterTransitionEvent) {
        ((AfterTransitionEvent) event).afterTransition(context);
      }
    }
    return toState;
  }

  TransitionTable<S, E> getTransitionTable() {
    return transitionTable;
  }

  static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  static void logWarning(final String machineId, final String message) {
    logger.warn(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

}
