package com.github.statecharts;

import java.util.Collections;
import java.util.List;

import com.github.statecharts.uml.Diagnostic;

/**
 * Unified single exception that's thrown and handled by the parser, the validator and the
 * dispatch engine. The idea is to use the code enum to encapsulate various error/exception
 * conditions. Parse and validation failures additionally carry the diagnostics that caused them.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final List<Diagnostic> diagnostics;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
    this.diagnostics = Collections.emptyList();
  }

  public StateMachineException(final Code code, final String message,
      final List<Diagnostic> diagnostics) {
    super(message);
    this.code = code;
    this.diagnostics = Collections.unmodifiableList(diagnostics);
  }

  public Code getCode() {
    return code;
  }

  /**
   * Diagnostics behind a {@link Code#SYNTAX_ERROR} or {@link Code#INVALID_CHART}, empty otherwise.
   */
  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public static enum Code {
    // 1.
    SYNTAX_ERROR("Statechart source text does not follow the grammar"),
    // 2.
    INVALID_CHART("Statechart failed validation and cannot be executed"),
    // 3.
    RESERVED_STATE("State id is reserved and cannot be declared or used as initial state"),
    // 4.
    UNKNOWN_STATE("State is not declared in this state machine"),
    // 5.
    INVALID_STATE("Null or empty state is invalid"),
    // 6.
    INVALID_TRANSITIONS("Transitions are null or malformed"),
    // 7.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 8.
    UNBOUND_BINDING("Guard, action or handler text has no bound callable"),
    // 9.
    TRANSITION_FAILURE(
        "Failed to transition to desired state. Check exception stacktrace for more details of the failure."),
    // 10.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire dispatch lock to perform requested operation. This is retryable.");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
