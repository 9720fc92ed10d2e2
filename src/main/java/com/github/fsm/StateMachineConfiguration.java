package com.github.fsm;

/**
 * This class encapsulates all the configuration parameters for the StateMachine. Use the
 * {@code StateMachineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. lockAcquisitionMillis of 0 (the default) makes trigger() and readCurrentState() wait for the
 * machine lock for as long as it takes. Any positive value bounds the wait, after which the call
 * fails with {@link StateMachineException.Code#OPERATION_LOCK_ACQUISITION_FAILURE}.<br>
 * 2. fairLock is on by default so that waiting callers are served in arrival order.<br>
 * 3. neither setting has any bearing on a stateless machine, which never locks.<br>
 */
public final class StateMachineConfiguration {
  private final long lockAcquisitionMillis;
  private final boolean fairLock;

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public boolean isFairLock() {
    return fairLock;
  }

  /**
   * Configuration with every parameter left at its default.
   */
  public static StateMachineConfiguration defaults() {
    return new StateMachineConfiguration(0L, true);
  }

  public final static class StateMachineConfigurationBuilder {
    private long lockAcquisitionMillis;
    private boolean fairLock = true;

    public static StateMachineConfigurationBuilder newBuilder() {
      return new StateMachineConfigurationBuilder();
    }

    public StateMachineConfigurationBuilder lockAcquisitionMillis(long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public StateMachineConfigurationBuilder fairLock(boolean fairLock) {
      this.fairLock = fairLock;
      return this;
    }

    public StateMachineConfiguration build() throws StateMachineException {
      final StateMachineConfiguration config =
          new StateMachineConfiguration(lockAcquisitionMillis, fairLock);
      config.validate();
      return config;
    }

    private StateMachineConfigurationBuilder() {}
  }

  private void validate() throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    if (lockAcquisitionMillis < 0L) {
      messages.append("lockAcquisitionMillis cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateMachineConfiguration [lockAcquisitionMillis=" + lockAcquisitionMillis
        + ", fairLock=" + fairLock + "]";
  }

  private StateMachineConfiguration(final long lockAcquisitionMillis, final boolean fairLock) {
    this.lockAcquisitionMillis = lockAcquisitionMillis;
    this.fairLock = fairLock;
  }

}
