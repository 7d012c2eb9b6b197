package com.github.statecharts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.statecharts.StateHandlers.StateHandlersBuilder;
import com.github.statecharts.StateMachine.StateMachineBuilder;
import com.github.statecharts.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.statecharts.StateMachineException.Code;
import com.github.statecharts.TransitionTable.TransitionTableBuilder;

/**
 * Tests to maintain the sanity and correctness of the dispatch engine.
 */
public class StateMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(StateMachineTest.class.getSimpleName());

  @Test
  public void testEventIgnoredWithoutRow() throws StateMachineException {
    // 1. machine with IDLE and SCAN, event only known in SCAN
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("IDLE").state("SCAN").initialState("IDLE").build();
    final StateId idle = machine.initialState();
    final StateId scan = state(machine, "SCAN");
    final TransitionTable stop =
        TransitionTableBuilder.newBuilder("stop").from(scan, idle).build();

    // 2. dispatch in IDLE
    final DispatchOutcome outcome = machine.dispatch(stop);
    assertEquals(DispatchOutcome.Kind.IGNORED, outcome.getKind());
    assertEquals(idle, machine.currentState());
    assertEquals(1L, machine.getStatistics().getIgnoredEvents());
    assertEquals(0L, machine.getStatistics().getTransitions());
  }

  @Test
  public void testOrderedEffectsOnAcceptedTransition() throws StateMachineException {
    final List<String> trace = new ArrayList<>();
    // 1. IDLE with exit, SCAN with entry
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("IDLE", StateHandlersBuilder.newBuilder().exit(() -> trace.add("exit IDLE"))
            .build())
        .state("SCAN", StateHandlersBuilder.newBuilder().entry(() -> trace.add("entry SCAN"))
            .build())
        .initialState("IDLE").build();
    final StateId scan = state(machine, "SCAN");

    // 2. IDLE -> SCAN with action act
    final TransitionTable start = TransitionTableBuilder.newBuilder("start")
        .from(machine.initialState(), new Transition(scan, null, () -> trace.add("act")))
        .build();
    final DispatchOutcome outcome = machine.dispatch(start);

    // 3. act exactly once, then exit, then entry
    assertTrue(outcome.isTransitioned());
    assertEquals(scan, outcome.getState());
    assertEquals(1, outcome.getSteps());
    assertEquals(Arrays.asList("act", "exit IDLE", "entry SCAN"), trace);
    assertEquals(scan, machine.currentState());
    assertEquals(1L, machine.getStatistics().getTransitions());
  }

  @Test
  public void testGuardFalseLeavesStateUntouched() throws StateMachineException {
    final List<String> trace = new ArrayList<>();
    final AtomicReference<StateId> seenByGuard = new AtomicReference<>();
    final StateMachine[] holder = new StateMachine[1];
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A", StateHandlersBuilder.newBuilder().exit(() -> trace.add("exit A")).build())
        .state("B", StateHandlersBuilder.newBuilder().entry(() -> trace.add("entry B")).build())
        .initialState("A").build();
    holder[0] = machine;
    final StateId a = machine.initialState();
    final StateId b = state(machine, "B");

    final Guard never = () -> {
      seenByGuard.set(holder[0].currentState());
      return false;
    };
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(a, new Transition(b, never, () -> trace.add("act"))).build();

    final DispatchOutcome outcome = machine.dispatch(go);
    assertEquals(DispatchOutcome.Kind.REJECTED, outcome.getKind());
    assertEquals(a, machine.currentState());
    assertTrue(trace.isEmpty());
    // the guard runs with the destination already reported as current
    assertEquals(b, seenByGuard.get());
    assertEquals(1L, machine.getStatistics().getRejectedTransitions());
  }

  @Test
  public void testFirstHoldingGuardWins() throws StateMachineException {
    final AtomicInteger count = new AtomicInteger(0);
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("GumballSold").state("NoQuarter").state("OutOfGumballs")
        .initialState("GumballSold").build();
    final TransitionTable next = TransitionTableBuilder.newBuilder("")
        .from(machine.initialState(),
            new Transition(state(machine, "NoQuarter"), () -> count.get() > 0, null))
        .from(machine.initialState(),
            new Transition(state(machine, "OutOfGumballs"), () -> count.get() == 0, null))
        .build();

    final DispatchOutcome outcome = machine.dispatch(next);
    assertTrue(outcome.isTransitioned());
    assertEquals("OutOfGumballs", machine.currentState().getName());
  }

  @Test
  public void testSelfTransitionSkipsExitAndEntry() throws StateMachineException {
    final List<String> trace = new ArrayList<>();
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("S", StateHandlersBuilder.newBuilder().entry(() -> trace.add("entry S"))
            .exit(() -> trace.add("exit S")).build())
        .initialState("S").build();
    final StateId s = machine.initialState();
    final TransitionTable tick = TransitionTableBuilder.newBuilder("tick")
        .from(s, new Transition(s, null, () -> trace.add("act"))).build();

    assertTrue(machine.dispatch(tick).isTransitioned());
    assertEquals(Collections.singletonList("act"), trace);
    assertEquals(s, machine.currentState());
  }

  @Test
  public void testInternalHandlerReplacesExitAndEntry() throws StateMachineException {
    final List<String> trace = new ArrayList<>();
    final StateMachine[] holder = new StateMachine[1];
    final TransitionTable[] onward = new TransitionTable[1];
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A", StateHandlersBuilder.newBuilder().exit(() -> trace.add("exit A"))
            .internal(() -> {
              trace.add("on A");
              // dropped: the internal handler ends the cycle
              fire(holder[0], onward[0]);
            }).build())
        .state("B", StateHandlersBuilder.newBuilder().entry(() -> trace.add("entry B")).build())
        .state("C").initialState("A").build();
    holder[0] = machine;
    final StateId b = state(machine, "B");
    onward[0] =
        TransitionTableBuilder.newBuilder("onward").from(b, state(machine, "C")).build();

    // leaving A for another state still runs only the internal handler
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(machine.initialState(), new Transition(b, null, () -> trace.add("act"))).build();
    final DispatchOutcome outcome = machine.dispatch(go);

    assertTrue(outcome.isTransitioned());
    assertEquals(1, outcome.getSteps());
    assertEquals(Arrays.asList("act", "on A"), trace);
    assertEquals(b, machine.currentState());
  }

  @Test
  public void testReentrantChainHasBoundedDepth() throws StateMachineException {
    final int chain = 10000;
    final AtomicInteger entries = new AtomicInteger();
    final Set<Integer> depths = new HashSet<>();
    final StateMachine[] holder = new StateMachine[1];
    final TransitionTable[] toggle = new TransitionTable[1];
    final Reaction bounce = () -> {
      depths.add(Thread.currentThread().getStackTrace().length);
      if (entries.incrementAndGet() < chain) {
        fire(holder[0], toggle[0]);
      }
    };
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("PING", StateHandlersBuilder.newBuilder().entry(bounce).build())
        .state("PONG", StateHandlersBuilder.newBuilder().entry(bounce).build())
        .initialState("PING").build();
    holder[0] = machine;
    final StateId ping = machine.initialState();
    final StateId pong = state(machine, "PONG");
    toggle[0] = TransitionTableBuilder.newBuilder("toggle").from(ping, pong).from(pong, ping)
        .build();

    final DispatchOutcome outcome = machine.dispatch(toggle[0]);
    assertTrue(outcome.isTransitioned());
    assertEquals(chain, outcome.getSteps());
    assertEquals(chain, entries.get());
    // an even number of toggles lands back on the initial state
    assertEquals(ping, machine.currentState());
    // every handler ran at the same stack depth
    assertEquals(1, depths.size());
    assertEquals(1L, machine.getStatistics().getDispatchCycles());
    assertEquals(chain, machine.getStatistics().getLongestChain());
  }

  @Test
  public void testReentrantRequestIsQueuedAndLastWins() throws StateMachineException {
    final AtomicReference<DispatchOutcome> inner = new AtomicReference<>();
    final StateMachine[] holder = new StateMachine[1];
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A").state("B").state("C").state("D").initialState("A").build();
    holder[0] = machine;
    final StateId b = state(machine, "B");
    final TransitionTable toC =
        TransitionTableBuilder.newBuilder("toC").from(b, state(machine, "C")).build();
    final TransitionTable toD =
        TransitionTableBuilder.newBuilder("toD").from(b, state(machine, "D")).build();
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(machine.initialState(), new Transition(b, null, () -> {
          inner.set(fire(holder[0], toC));
          fire(holder[0], toD);
        })).build();

    final DispatchOutcome outcome = machine.dispatch(go);
    assertEquals(DispatchOutcome.Kind.QUEUED, inner.get().getKind());
    assertEquals("C", inner.get().getState().getName());
    assertEquals(2, outcome.getSteps());
    assertEquals("D", machine.currentState().getName());
  }

  @Test
  public void testRequestFromRefusedGuardIsDropped() throws StateMachineException {
    // 1. A -> B behind a guard requesting B -> C and refusing, then unguarded A -> D
    final StateMachine[] holder = new StateMachine[1];
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A").state("B").state("C").state("D").initialState("A").build();
    holder[0] = machine;
    final StateId b = state(machine, "B");
    final TransitionTable toC =
        TransitionTableBuilder.newBuilder("toC").from(b, state(machine, "C")).build();
    final Guard refusing = () -> {
      fire(holder[0], toC);
      return false;
    };
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(machine.initialState(), new Transition(b, refusing, null))
        .from(machine.initialState(), state(machine, "D")).build();

    // 2. D has no row towards C, the request dies with its guard
    final DispatchOutcome outcome = machine.dispatch(go);
    assertTrue(outcome.isTransitioned());
    assertEquals(1, outcome.getSteps());
    assertEquals("D", machine.currentState().getName());
    assertEquals(1L, machine.getStatistics().getTransitions());
  }

  @Test
  public void testCannotHappenIsFatal() throws StateMachineException {
    final AtomicReference<String> fatal = new AtomicReference<>();
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(recordingConfig(fatal)).state("A").state("B").initialState("A").build();
    final TransitionTable forbidden = TransitionTableBuilder.newBuilder("forbidden")
        .from(machine.initialState(), StateId.CANNOT_HAPPEN).build();

    final DispatchOutcome outcome = machine.dispatch(forbidden);
    assertEquals(DispatchOutcome.Kind.FATAL, outcome.getKind());
    assertNotNull(fatal.get());
    assertTrue(outcome.getReason().contains("Forbidden"));
    assertEquals(machine.initialState(), machine.currentState());
    assertEquals(1L, machine.getStatistics().getFatalAborts());
  }

  @Test
  public void testUndeclaredDestinationIsFatal() throws StateMachineException {
    final AtomicReference<String> fatal = new AtomicReference<>();
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(recordingConfig(fatal)).state("A").state("B").initialState("A").build();
    final TransitionTable stray = TransitionTableBuilder.newBuilder("stray")
        .from(machine.initialState(), StateId.of(7, "Z")).build();

    final DispatchOutcome outcome = machine.dispatch(stray);
    assertEquals(DispatchOutcome.Kind.FATAL, outcome.getKind());
    assertTrue(fatal.get().contains("Z"));
    assertEquals("A", machine.currentState().getName());
  }

  @Test
  public void testIgnoringEventSentinel() throws StateMachineException {
    final AtomicReference<String> fatal = new AtomicReference<>();
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(recordingConfig(fatal)).state("A").initialState("A").build();
    final TransitionTable noop = TransitionTableBuilder.newBuilder("noop")
        .from(machine.initialState(), StateId.IGNORING_EVENT).build();

    final DispatchOutcome outcome = machine.dispatch(noop);
    assertEquals(DispatchOutcome.Kind.IGNORED, outcome.getKind());
    assertEquals("A", machine.currentState().getName());
    assertNull(fatal.get());
  }

  @Test
  public void testFailingReactionsSurfaceAsTransitionFailure() throws StateMachineException {
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A").state("B").initialState("A").build();
    final StateId b = state(machine, "B");
    final TransitionTable broken = TransitionTableBuilder.newBuilder("broken")
        .from(machine.initialState(), new Transition(b, () -> {
          throw new IllegalStateException("guard blew up");
        }, null)).build();
    try {
      machine.dispatch(broken);
      fail("expected a transition failure");
    } catch (StateMachineException expected) {
      assertEquals(Code.TRANSITION_FAILURE, expected.getCode());
    }
    // a failing guard restores the source state
    assertEquals("A", machine.currentState().getName());

    final TransitionTable failingAction = TransitionTableBuilder.newBuilder("act")
        .from(machine.initialState(), new Transition(b, null, () -> {
          throw new IllegalArgumentException("action blew up");
        })).build();
    try {
      machine.dispatch(failingAction);
      fail("expected a transition failure");
    } catch (StateMachineException expected) {
      assertEquals(Code.TRANSITION_FAILURE, expected.getCode());
      assertTrue(expected.getCause() instanceof IllegalArgumentException);
    }
  }

  @Test
  public void testReset() throws StateMachineException {
    final StateMachine machine = StateMachineBuilder.newBuilder().config(recordingConfig(null))
        .state("A").state("B").initialState("A").build();
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(machine.initialState(), state(machine, "B")).build();
    assertTrue(machine.dispatch(go).isTransitioned());
    assertEquals("B", machine.currentState().getName());

    machine.reset();
    assertSame(machine.initialState(), machine.currentState());
  }

  @Test
  public void testBuilderRejectsReservedAndUnknownStates() throws StateMachineException {
    try {
      StateMachineBuilder.newBuilder().state("A").initialState("CANNOT_HAPPEN").build();
      fail("reserved initial state accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.RESERVED_STATE, expected.getCode());
    }
    try {
      StateMachineBuilder.newBuilder().state("A").state("MAX_STATES").initialState("A").build();
      fail("reserved state accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.RESERVED_STATE, expected.getCode());
    }
    try {
      StateMachineBuilder.newBuilder().state("A").initialState("B").build();
      fail("unknown initial state accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
    try {
      TransitionTableBuilder.newBuilder("bad").from(StateId.IGNORING_EVENT, StateId.of(0, "A"));
      fail("sentinel source accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_TRANSITIONS, expected.getCode());
    }
  }

  @Test
  public void testOuterDispatchTimesOutWhileAnotherThreadDispatches() throws Exception {
    final CountDownLatch entered = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().lockAcquisitionMillis(50L)
            .fatalErrorHandler(FatalErrorHandlers.recording(null)).build())
        .state("A").state("B", StateHandlersBuilder.newBuilder().entry(() -> {
          entered.countDown();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
          }
        }).build()).initialState("A").build();
    final TransitionTable go = TransitionTableBuilder.newBuilder("go")
        .from(machine.initialState(), state(machine, "B")).build();

    final ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      final Future<DispatchOutcome> slow = executor.submit(() -> machine.dispatch(go));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      try {
        machine.dispatch(go);
        fail("expected lock acquisition to time out");
      } catch (StateMachineException expected) {
        assertEquals(Code.OPERATION_LOCK_ACQUISITION_FAILURE, expected.getCode());
      }
      release.countDown();
      assertTrue(slow.get(5, TimeUnit.SECONDS).isTransitioned());
    } finally {
      release.countDown();
      executor.shutdownNow();
    }
  }

  @Test
  public void testConcurrentDispatchers() throws Exception {
    final int workers = 4;
    final int dispatchesPerWorker = 500;
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder().lockAcquisitionMillis(10000L)
            .fatalErrorHandler(FatalErrorHandlers.recording(null)).build())
        .state("ON").state("OFF").initialState("OFF").build();
    final StateId on = state(machine, "ON");
    final StateId off = state(machine, "OFF");
    final TransitionTable flip =
        TransitionTableBuilder.newBuilder("flip").from(on, off).from(off, on).build();

    final ExecutorService executor = Executors.newFixedThreadPool(workers);
    try {
      final List<Future<Integer>> results = new ArrayList<>();
      for (int worker = 0; worker < workers; worker++) {
        results.add(executor.submit(() -> {
          int transitioned = 0;
          for (int iter = 0; iter < dispatchesPerWorker; iter++) {
            if (machine.dispatch(flip).isTransitioned()) {
              transitioned++;
            }
          }
          return transitioned;
        }));
      }
      int total = 0;
      for (Future<Integer> result : results) {
        total += result.get(30, TimeUnit.SECONDS);
      }
      assertEquals(workers * dispatchesPerWorker, total);
    } finally {
      executor.shutdownNow();
    }
    // an even number of flips
    assertEquals(off, machine.currentState());
    assertEquals((long) workers * dispatchesPerWorker,
        machine.getStatistics().getTransitions());
    logger.info(machine.getStatistics());
  }

  @Test
  public void testHandlersAndStringifier() throws StateMachineException {
    final StateHandlers handlers = StateHandlersBuilder.newBuilder().activity(() -> {
    }).build();
    final StateMachine machine = StateMachineBuilder.newBuilder()
        .config(StateMachineConfigurationBuilder.newBuilder()
            .stringifier(state -> "<" + state.getName() + ">").build())
        .state("A", handlers).initialState("A").build();
    assertSame(handlers, machine.getHandlers(machine.initialState()));
    assertTrue(machine.getHandlers(machine.initialState()).getActivity().isPresent());
    assertFalse(machine.getHandlers(machine.initialState()).getEntry().isPresent());
    assertEquals("<A>", machine.stringify(machine.initialState()));
    try {
      machine.getHandlers(StateId.of(3, "Q"));
      fail("undeclared state accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.UNKNOWN_STATE, expected.getCode());
    }
  }

  static StateMachineConfiguration recordingConfig(final AtomicReference<String> fatal)
      throws StateMachineException {
    return StateMachineConfigurationBuilder.newBuilder()
        .fatalErrorHandler(FatalErrorHandlers.recording(fatal)).build();
  }

  static StateId state(final StateMachine machine, final String name) {
    for (StateId state : machine.getStates()) {
      if (state.getName().equals(name)) {
        return state;
      }
    }
    throw new IllegalArgumentException("No state " + name);
  }

  /**
   * Dispatch from inside a reaction, where checked exceptions cannot escape.
   */
  static DispatchOutcome fire(final StateMachine machine, final TransitionTable table) {
    try {
      return machine.dispatch(table);
    } catch (StateMachineException problem) {
      throw new IllegalStateException(problem);
    }
  }

  static final class FatalErrorHandlers {
    static FatalErrorHandler recording(final AtomicReference<String> reasons) {
      return (machineId, reason) -> {
        logger.warn("Fatal in machine " + machineId + ": " + reason);
        if (reasons != null) {
          reasons.set(reason);
        }
      };
    }
  }

}
