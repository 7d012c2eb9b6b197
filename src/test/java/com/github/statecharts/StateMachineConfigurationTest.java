package com.github.statecharts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.statecharts.ChartBindings.BindingsBuilder;
import com.github.statecharts.StateMachineConfiguration.StateMachineConfigurationBuilder;
import com.github.statecharts.StateMachineException.Code;

/**
 * Tests for machine configuration and chart bindings.
 */
public class StateMachineConfigurationTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testDefaults() throws StateMachineException {
    final StateMachineConfiguration config = StateMachineConfigurationBuilder.newBuilder().build();
    assertEquals(StateMachineConfiguration.DEFAULT_LOCK_ACQUISITION_MILLIS,
        config.getLockAcquisitionMillis());
    assertSame(FatalErrorHandler.EXIT, config.getFatalErrorHandler());
    assertEquals("A", config.getStringifier().apply(StateId.of(0, "A")));
    assertEquals(StateMachineConfiguration.DEFAULT_LOCK_ACQUISITION_MILLIS,
        StateMachineConfiguration.defaults().getLockAcquisitionMillis());
  }

  @Test
  public void testEveryProblemIsReported() {
    try {
      StateMachineConfigurationBuilder.newBuilder().lockAcquisitionMillis(0L)
          .fatalErrorHandler(null).stringifier(null).build();
      fail("invalid configuration accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_MACHINE_CONFIG, expected.getCode());
      assertTrue(expected.getMessage().contains("lockAcquisitionMillis"));
      assertTrue(expected.getMessage().contains("FatalErrorHandler"));
      assertTrue(expected.getMessage().contains("Stringifier"));
    }
  }

  @Test
  public void testBindingsAreTrimmedAndStrict() throws StateMachineException {
    final Reaction beep = () -> {
    };
    final Guard ready = () -> true;
    final ChartBindings bindings =
        BindingsBuilder.newBuilder().action(" beep(); ", beep).guard("ready", ready).build();
    assertSame(beep, bindings.action("beep();"));
    assertSame(ready, bindings.guard("  ready"));
    assertTrue(bindings.hasAction("beep();"));
    try {
      bindings.guard("steady");
      fail("unbound guard resolved");
    } catch (StateMachineException expected) {
      assertEquals(Code.UNBOUND_BINDING, expected.getCode());
    }
    try {
      ChartBindings.NONE.action("beep();");
      fail("unbound action resolved");
    } catch (StateMachineException expected) {
      assertEquals(Code.UNBOUND_BINDING, expected.getCode());
    }
  }

  @Test
  public void testStateIds() throws StateMachineException {
    assertSame(StateId.CANNOT_HAPPEN, StateId.sentinel("CANNOT_HAPPEN"));
    assertSame(StateId.IGNORING_EVENT, StateId.sentinel("IGNORING_EVENT"));
    assertEquals(null, StateId.sentinel("MAX_STATES"));
    assertTrue(StateId.isReserved("MAX_STATES"));
    assertEquals(StateId.of(2, " B "), StateId.of(2, "B"));
    try {
      StateId.of(0, " ");
      fail("blank state accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      StateId.of(-1, "A");
      fail("negative index accepted");
    } catch (StateMachineException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }
}
