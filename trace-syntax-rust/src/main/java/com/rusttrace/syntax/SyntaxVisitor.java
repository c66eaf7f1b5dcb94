package com.rusttrace.syntax;

/**
 * Callbacks for a depth-first walk started with {@link SyntaxNode#accept(SyntaxVisitor)}.
 */
public interface SyntaxVisitor {

    void enterNode(SyntaxNode node);

    void exitNode(SyntaxNode node);

    void visitToken(SyntaxToken token);
}
