package com.github.statecharts.uml;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateMachineException;
import com.github.statecharts.model.Statechart;

/**
 * Entry points of the text to model pipeline: lexing, parsing, assembling and validating.
 */
public final class Statecharts {
  private static final Logger logger = LogManager.getLogger(Statecharts.class.getSimpleName());

  private Statecharts() {}

  /**
   * Parse and assemble without validating. Fails with a syntax error on malformed input.
   */
  public static Statechart parse(final String name, final String source)
      throws StateMachineException {
    return StatechartAssembler.assemble(StatechartParser.parse(source), name);
  }

  public static ValidationReport validate(final Statechart chart) {
    return StatechartValidator.validate(chart);
  }

  /**
   * Parse, assemble and validate. Warnings are logged, any error fails the load with
   * {@link StateMachineException.Code#INVALID_CHART}.
   */
  public static Statechart load(final String name, final String source)
      throws StateMachineException {
    final ValidationReport report = validate(parse(name, source));
    for (Diagnostic warning : report.getWarnings()) {
      logger.warn(report.getChart().getName() + ": " + warning);
    }
    final Statechart chart = report.usableChart();
    logger.info("Loaded statechart " + chart.getName() + " with " + chart.getStates().size()
        + " states and " + chart.getTransitions().size() + " transitions");
    return chart;
  }
}
