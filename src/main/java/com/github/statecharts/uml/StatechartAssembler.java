package com.github.statecharts.uml;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StateId;
import com.github.statecharts.model.ChartEvent;
import com.github.statecharts.model.ChartTransition;
import com.github.statecharts.model.HandlerKind;
import com.github.statecharts.model.Pragma;
import com.github.statecharts.model.PragmaKind;
import com.github.statecharts.model.Statechart;
import com.github.statecharts.model.Statechart.ScopeBuilder;

/**
 * Normalizes a parse tree into the {@link Statechart} IR in a single walk.
 *
 * Transitions and clauses declare their states implicitly in the scope they appear in. Reversed
 * arrows are swapped here. An {@code on} clause becomes the state's internal handler plus a
 * self-transition carrying the event and guard. A destination spelled {@code IGNORING_EVENT} or
 * {@code CANNOT_HAPPEN} stays a sentinel and declares nothing. Comments, directives and notes are
 * dropped.
 */
public final class StatechartAssembler implements SyntaxVisitor {
  private static final Logger logger =
      LogManager.getLogger(StatechartAssembler.class.getSimpleName());

  private final Deque<ScopeBuilder> scopes = new ArrayDeque<>();
  private Statechart result;

  private StatechartAssembler() {}

  public static Statechart assemble(final SyntaxTree.ChartNode chart, final String defaultName) {
    final StatechartAssembler assembler = new StatechartAssembler();
    final String name = chart.getName().isEmpty() ? defaultName : chart.getName();
    assembler.scopes.push(ScopeBuilder.newBuilder(name));
    chart.accept(assembler);
    return assembler.result;
  }

  @Override
  public void visitChart(final SyntaxTree.ChartNode chart) {
    visitAll(chart.getBody());
    result = scopes.pop().build();
    if (logger.isDebugEnabled()) {
      logger.debug("Assembled " + result);
    }
  }

  @Override
  public void visitComment(final SyntaxTree.CommentNode comment) {
    // not part of the model
  }

  @Override
  public void visitPragma(final SyntaxTree.PragmaNode pragma) {
    scope().pragma(new Pragma(PragmaKind.fromTag(pragma.getKind()), pragma.getText(),
        pragma.getLine()));
  }

  @Override
  public void visitDirective(final SyntaxTree.DirectiveNode directive) {
    // rendering only
  }

  @Override
  public void visitStateBlock(final SyntaxTree.StateBlockNode block) {
    final ScopeBuilder parent = scope();
    parent.declareState(block.getName(), block.getLine());
    for (List<SyntaxTree.Node> region : block.getRegions()) {
      scopes.push(parent.region(block.getName(), block.getLine()));
      try {
        visitAll(region);
      } finally {
        scopes.pop();
      }
    }
  }

  @Override
  public void visitStateClause(final SyntaxTree.StateClauseNode clause) {
    final ScopeBuilder scope = scope();
    final String state = clause.getState();
    final SyntaxTree.Label label = clause.getLabel();
    final int line = clause.getLine();
    switch (clause.getKeyword()) {
      case "entry":
      case "entering":
        scope.handler(state, HandlerKind.ENTRY, label.getAction().get(), line);
        break;
      case "exit":
      case "leaving":
        scope.handler(state, HandlerKind.EXIT, label.getAction().get(), line);
        break;
      case "do":
      case "activity":
        scope.handler(state, HandlerKind.ACTIVITY, label.getAction().get(), line);
        break;
      case "comment":
        scope.comment(state, label.getAction().isPresent() ? label.getAction().get().getText()
            : "", line);
        break;
      default:
        // "on" and "event"
        if (label.getAction().isPresent()) {
          scope.handler(state, HandlerKind.INTERNAL, label.getAction().get(), line);
        } else {
          scope.touchState(state, line);
        }
        scope.transition(ChartTransition.TransitionBuilder.newBuilder(state, state)
            .event(event(label)).guard(label.getGuard().orElse(null)).internal(true).line(line)
            .build());
        break;
    }
  }

  @Override
  public void visitTransition(final SyntaxTree.TransitionNode transition) {
    final ScopeBuilder scope = scope();
    final String source = transition.isReversed() ? transition.getRight() : transition.getLeft();
    final String destination =
        transition.isReversed() ? transition.getLeft() : transition.getRight();
    final SyntaxTree.Label label = transition.getLabel();
    scope.touchState(source, transition.getLine());
    if (StateId.sentinel(destination) == null) {
      scope.touchState(destination, transition.getLine());
    }
    scope.transition(ChartTransition.TransitionBuilder.newBuilder(source, destination)
        .event(event(label)).guard(label.getGuard().orElse(null))
        .action(label.getAction().orElse(null)).arrow(transition.getArrow())
        .line(transition.getLine()).build());
  }

  @Override
  public void visitNote(final SyntaxTree.NoteNode note) {
    // notes are inert
  }

  private static ChartEvent event(final SyntaxTree.Label label) {
    if (label.getWords().isEmpty()) {
      return null;
    }
    return new ChartEvent(label.getWords(), label.getParameters().orElse(null));
  }

  private void visitAll(final List<SyntaxTree.Node> nodes) {
    for (SyntaxTree.Node node : nodes) {
      node.accept(this);
    }
  }

  private ScopeBuilder scope() {
    return scopes.peek();
  }
}
