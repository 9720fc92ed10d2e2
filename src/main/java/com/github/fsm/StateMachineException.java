package com.github.fsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate various error/exception conditions. Build-time codes are always fatal to the
 * build; trigger-time codes ({@link Code#NO_TRANSITION}, {@link Code#GUARD_REJECTED}) are
 * recoverable and leave the machine in its pre-call state.
 * 
 * Failures raised by caller supplied guards and hooks are never wrapped into this exception.
 */
public class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    EMPTY_STATE_SET("State machine must have at least one state"),
    // 2.
    INITIAL_STATE_NOT_SET("Initial state must be set"),
    // 3.
    INVALID_INITIAL_STATE("Initial state must be one of the registered states"),
    // 4.
    NO_TRANSITION("No transition registered for the current state and given event"),
    // 5.
    GUARD_REJECTED("Guard condition not met for the requested transition"),
    // 6.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 7.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 8.
    INTERRUPTED("State machine was interrupted"),
    // 9.
    INVALID_DIAGRAM_FORMAT("Unsupported diagram format"),
    // 10.
    REENTRANT_TRIGGER("Guards and hooks cannot trigger the machine they are invoked by");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
