package com.rusttrace.syntax;

/**
 * Common supertype of {@link SyntaxNode} and {@link SyntaxToken}.
 * Elements are immutable once the parser has finished building the tree.
 */
public abstract class SyntaxElement {

    private final SyntaxKind kind;
    private SyntaxNode parent;
    private int indexInParent = -1;

    SyntaxElement(SyntaxKind kind) {
        this.kind = kind;
    }

    public SyntaxKind kind() { return kind; }

    /** Enclosing node, or null for the root. */
    public SyntaxNode parent() { return parent; }

    public abstract TextRange textRange();

    public abstract String text();

    public abstract void accept(SyntaxVisitor visitor);

    public SyntaxElement nextSiblingOrToken() {
        if (parent == null) return null;
        int next = indexInParent + 1;
        return next < parent.childCount() ? parent.childAt(next) : null;
    }

    public SyntaxElement prevSiblingOrToken() {
        if (parent == null || indexInParent == 0) return null;
        return parent.childAt(indexInParent - 1);
    }

    void attach(SyntaxNode parent, int indexInParent) {
        this.parent = parent;
        this.indexInParent = indexInParent;
    }
}
