package com.github.statecharts;

import java.util.function.Function;

/**
 * This class encapsulates all the configuration parameters for the StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. lockAcquisitionMillis bounds how long an outer dispatch from another thread waits for the
 * machine. Reentrant dispatches from handlers running on the owning thread never wait.<br>
 * 2. the fatalErrorHandler defaults to {@link FatalErrorHandler#EXIT}, which terminates the JVM.
 * Replacing it is meant for tests and embedding hosts that own process shutdown.<br>
 * 3. the stringifier renders states in log lines; it defaults to the state name.<br>
 */
public final class StateMachineConfiguration {
  static final long DEFAULT_LOCK_ACQUISITION_MILLIS = 100L;

  private final long lockAcquisitionMillis;
  private final FatalErrorHandler fatalErrorHandler;
  private final Function<StateId, String> stringifier;

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public FatalErrorHandler getFatalErrorHandler() {
    return fatalErrorHandler;
  }

  public Function<StateId, String> getStringifier() {
    return stringifier;
  }

  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(DEFAULT_LOCK_ACQUISITION_MILLIS, FatalErrorHandler.EXIT,
        StateId::getName);
  }

  public final static class StateMachineConfigurationBuilder {
    private long lockAcquisitionMillis = DEFAULT_LOCK_ACQUISITION_MILLIS;
    private FatalErrorHandler fatalErrorHandler = FatalErrorHandler.EXIT;
    private Function<StateId, String> stringifier = StateId::getName;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder lockAcquisitionMillis(long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public StateMachineConfigurationBuilder fatalErrorHandler(
        final FatalErrorHandler fatalErrorHandler) {
      this.fatalErrorHandler = fatalErrorHandler;
      return this;
    }

    public StateMachineConfigurationBuilder stringifier(
        final Function<StateId, String> stringifier) {
      this.stringifier = stringifier;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(lockAcquisitionMillis, fatalErrorHandler, stringifier);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (lockAcquisitionMillis <= 0L) {
      messages.append("lockAcquisitionMillis must be positive. ");
    }
    if (fatalErrorHandler == null) {
      messages.append("FatalErrorHandler cannot be null. ");
    }
    if (stringifier == null) {
      messages.append("Stringifier cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [lockAcquisitionMillis=" + lockAcquisitionMillis
        + ", fatalErrorHandler=" + fatalErrorHandler + "]";
  }

  private StateMachineConfiguration(final long lockAcquisitionMillis,
      final FatalErrorHandler fatalErrorHandler, final Function<StateId, String> stringifier) {
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.fatalErrorHandler = fatalErrorHandler;
    this.stringifier = stringifier;
  }

}
