package com.github.statecharts.uml;

/**
 * Walks a {@link SyntaxTree}. Composite nodes do not visit their children on their own.
 */
public interface SyntaxVisitor {
  void visitChart(SyntaxTree.ChartNode chart);

  void visitComment(SyntaxTree.CommentNode comment);

  void visitPragma(SyntaxTree.PragmaNode pragma);

  void visitDirective(SyntaxTree.DirectiveNode directive);

  void visitStateBlock(SyntaxTree.StateBlockNode block);

  void visitStateClause(SyntaxTree.StateClauseNode clause);

  void visitTransition(SyntaxTree.TransitionNode transition);

  void visitNote(SyntaxTree.NoteNode note);
}
