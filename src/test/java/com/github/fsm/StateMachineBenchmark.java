package com.github.fsm;

import static com.github.fsm.TransitionOptions.withGuard;

import java.util.concurrent.atomic.AtomicBoolean;

import org.openjdk.jmh.annotations.Benchmark;

import com.github.fsm.StateMachineTest.DoorEvent;
import com.github.fsm.StateMachineTest.DoorState;

/**
 * Micro-benchmarks of the trigger path for both machine flavors.
 */
public class StateMachineBenchmark {
  private static final StatelessStateMachine<DoorState, DoorEvent> statelessMachine;
  private static final StateMachine<DoorState, DoorEvent> statefulMachine;
  static {
    try {
      statelessMachine =
          StateMachineTest.doorMachineBuilder(new AtomicBoolean()).buildStateless();
      statefulMachine = StateMachineTest.doorMachineBuilder(new AtomicBoolean()).build();
    } catch (StateMachineException problem) {
      throw new ExceptionInInitializerError(problem);
    }
  }

  @Benchmark
  public DoorState testStatelessTrigger() throws StateMachineException {
    // CLOSED->OPEN->CLOSED
    final DoorState open = statelessMachine.trigger(DoorState.CLOSED, DoorEvent.OPEN_DOOR);
    return statelessMachine.trigger(open, DoorEvent.CLOSE_DOOR);
  }

  @Benchmark
  public DoorState testStatefulTrigger() throws StateMachineException {
    // CLOSED->OPEN->CLOSED
    statefulMachine.trigger(DoorEvent.OPEN_DOOR);
    statefulMachine.trigger(DoorEvent.CLOSE_DOOR);
    return statefulMachine.readCurrentState();
  }

  @Benchmark
  public StateMachine<DoorState, DoorEvent> testBuild() throws StateMachineException {
    return StateMachineBuilder.<DoorState, DoorEvent>newBuilder().addStates(DoorState.values())
        .initialState(DoorState.CLOSED)
        .addTransition(DoorState.CLOSED, DoorState.OPEN, DoorEvent.OPEN_DOOR)
        .addTransition(DoorState.CLOSED, DoorState.LOCKED, DoorEvent.LOCK_DOOR,
            withGuard((context, from, to, event) -> true))
        .build();
  }

  public static void main(String args[]) throws StateMachineException {
    StateMachineBenchmark benchmark = new StateMachineBenchmark();
    benchmark.testStatelessTrigger();
    benchmark.testStatefulTrigger();
    benchmark.testBuild();
  }

}
