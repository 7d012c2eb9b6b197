package com.github.statecharts.uml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.statecharts.model.ChartAction;

/**
 * Concrete parse tree of a statechart source. Nodes mirror the grammar productions one to one and
 * keep every piece of text as written; normalization happens in {@link StatechartAssembler}.
 */
public final class SyntaxTree {

  private SyntaxTree() {}

  public static abstract class Node {
    private final int line;
    private final int column;

    Node(final int line, final int column) {
      this.line = line;
      this.column = column;
    }

    public int getLine() {
      return line;
    }

    public int getColumn() {
      return column;
    }

    public abstract void accept(final SyntaxVisitor visitor);
  }

  /**
   * {@code @startuml [name] body @enduml}
   */
  public static final class ChartNode extends Node {
    private final String name;
    private final List<Node> body;

    ChartNode(final int line, final int column, final String name, final List<Node> body) {
      super(line, column);
      this.name = name;
      this.body = Collections.unmodifiableList(new ArrayList<>(body));
    }

    /**
     * Name written after {@code @startuml}, empty when absent.
     */
    public String getName() {
      return name;
    }

    public List<Node> getBody() {
      return body;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitChart(this);
    }
  }

  public static final class CommentNode extends Node {
    private final String text;

    CommentNode(final int line, final int column, final String text) {
      super(line, column);
      this.text = text;
    }

    public String getText() {
      return text;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitComment(this);
    }
  }

  /**
   * {@code '[kind] text}
   */
  public static final class PragmaNode extends Node {
    private final String kind;
    private final String text;

    PragmaNode(final int line, final int column, final String kind, final String text) {
      super(line, column);
      this.kind = kind;
      this.text = text;
    }

    public String getKind() {
      return kind;
    }

    public String getText() {
      return text;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitPragma(this);
    }
  }

  /**
   * {@code skinparam ...}, {@code hide ...} and alike.
   */
  public static final class DirectiveNode extends Node {
    private final String text;

    DirectiveNode(final int line, final int column, final String text) {
      super(line, column);
      this.text = text;
    }

    public String getText() {
      return text;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitDirective(this);
    }
  }

  /**
   * {@code state NAME} or {@code state NAME { body }}. A body split by region separators yields
   * one entry per region.
   */
  public static final class StateBlockNode extends Node {
    private final String name;
    private final List<List<Node>> regions;

    StateBlockNode(final int line, final int column, final String name,
        final List<List<Node>> regions) {
      super(line, column);
      this.name = name;
      final List<List<Node>> frozen = new ArrayList<>(regions.size());
      for (List<Node> region : regions) {
        frozen.add(Collections.unmodifiableList(new ArrayList<>(region)));
      }
      this.regions = Collections.unmodifiableList(frozen);
    }

    public String getName() {
      return name;
    }

    public List<List<Node>> getRegions() {
      return regions;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitStateBlock(this);
    }
  }

  /**
   * {@code STATE : keyword label}
   */
  public static final class StateClauseNode extends Node {
    private final String state;
    private final String keyword;
    private final Label label;

    StateClauseNode(final int line, final int column, final String state, final String keyword,
        final Label label) {
      super(line, column);
      this.state = state;
      this.keyword = keyword;
      this.label = label;
    }

    public String getState() {
      return state;
    }

    /**
     * The clause keyword as written, e.g. {@code entry} or {@code leaving}.
     */
    public String getKeyword() {
      return keyword;
    }

    public Label getLabel() {
      return label;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitStateClause(this);
    }
  }

  /**
   * {@code LEFT ARROW RIGHT [: label]}, endpoints as written (not yet swapped).
   */
  public static final class TransitionNode extends Node {
    private final String left;
    private final String arrow;
    private final String right;
    private final Label label;

    TransitionNode(final int line, final int column, final String left, final String arrow,
        final String right, final Label label) {
      super(line, column);
      this.left = left;
      this.arrow = arrow;
      this.right = right;
      this.label = label;
    }

    public String getLeft() {
      return left;
    }

    public String getArrow() {
      return arrow;
    }

    public String getRight() {
      return right;
    }

    public boolean isReversed() {
      return arrow.startsWith("<");
    }

    public Label getLabel() {
      return label;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitTransition(this);
    }
  }

  public static final class NoteNode extends Node {
    private final String side;
    private final String state;
    private final String text;

    NoteNode(final int line, final int column, final String side, final String state,
        final String text) {
      super(line, column);
      this.side = side;
      this.state = state;
      this.text = text;
    }

    public String getSide() {
      return side;
    }

    public String getState() {
      return state;
    }

    public String getText() {
      return text;
    }

    @Override
    public void accept(final SyntaxVisitor visitor) {
      visitor.visitNote(this);
    }
  }

  /**
   * The part after {@code :}: event words with optional parameters, guard and action. Every part is
   * optional.
   */
  public static final class Label {
    public static final Label EMPTY =
        new Label(Collections.<String>emptyList(), null, null, null);

    private final List<String> words;
    private final String parameters;
    private final String guard;
    private final ChartAction action;

    Label(final List<String> words, final String parameters, final String guard,
        final ChartAction action) {
      this.words = Collections.unmodifiableList(new ArrayList<>(words));
      this.parameters = parameters;
      this.guard = guard;
      this.action = action;
    }

    public List<String> getWords() {
      return words;
    }

    public Optional<String> getParameters() {
      return Optional.ofNullable(parameters);
    }

    public Optional<String> getGuard() {
      return Optional.ofNullable(guard);
    }

    public Optional<ChartAction> getAction() {
      return Optional.ofNullable(action);
    }
  }
}
