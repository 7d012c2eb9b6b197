package com.github.statecharts.uml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.statecharts.StateMachineException;
import com.github.statecharts.StateMachineException.Code;
import com.github.statecharts.model.Statechart;

/**
 * Every diagnostic found while validating one chart. Any error makes the chart unusable for both
 * execution and emission.
 */
public final class ValidationReport {
  private final Statechart chart;
  private final List<Diagnostic> diagnostics;

  ValidationReport(final Statechart chart, final List<Diagnostic> diagnostics) {
    this.chart = chart;
    this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
  }

  public Statechart getChart() {
    return chart;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public List<Diagnostic> getErrors() {
    final List<Diagnostic> errors = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      if (diagnostic.isError()) {
        errors.add(diagnostic);
      }
    }
    return errors;
  }

  public List<Diagnostic> getWarnings() {
    final List<Diagnostic> warnings = new ArrayList<>();
    for (Diagnostic diagnostic : diagnostics) {
      if (!diagnostic.isError()) {
        warnings.add(diagnostic);
      }
    }
    return warnings;
  }

  public boolean isUsable() {
    return getErrors().isEmpty();
  }

  /**
   * Returns the chart when usable, throws {@link Code#INVALID_CHART} listing every error otherwise.
   */
  public Statechart usableChart() throws StateMachineException {
    final List<Diagnostic> errors = getErrors();
    if (!errors.isEmpty()) {
      final StringBuilder message = new StringBuilder("Statechart ").append(chart.getName())
          .append(" has ").append(errors.size()).append(" error(s):");
      for (Diagnostic error : errors) {
        message.append("\n    ").append(error);
      }
      throw new StateMachineException(Code.INVALID_CHART, message.toString(), diagnostics);
    }
    return chart;
  }

  @Override
  public String toString() {
    return "ValidationReport [chart=" + chart.getName() + ", diagnostics=" + diagnostics + "]";
  }
}
