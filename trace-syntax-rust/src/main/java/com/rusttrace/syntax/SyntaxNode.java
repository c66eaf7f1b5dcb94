package com.rusttrace.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Interior node of the syntax tree. Children are kept in document order and include
 * tokens (whitespace and comments too), so the tree reproduces the source text exactly.
 */
public final class SyntaxNode extends SyntaxElement {

    private final List<SyntaxElement> elements = new ArrayList<>();
    private TextRange range;

    SyntaxNode(SyntaxKind kind) {
        super(kind);
    }

    // --- Building (parser only) ---

    void append(SyntaxElement element) {
        element.attach(this, elements.size());
        elements.add(element);
    }

    void seal(int emptyOffset) {
        if (elements.isEmpty()) {
            range = new TextRange(emptyOffset, emptyOffset);
        } else {
            range = new TextRange(
                elements.get(0).textRange().start(),
                elements.get(elements.size() - 1).textRange().end());
        }
    }

    int childCount() { return elements.size(); }

    SyntaxElement childAt(int index) { return elements.get(index); }

    // --- Navigation ---

    @Override
    public TextRange textRange() { return range; }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        for (SyntaxElement e : elements) {
            if (e instanceof SyntaxNode) {
                ((SyntaxNode) e).appendText(sb);
            } else {
                sb.append(e.text());
            }
        }
    }

    /** All child nodes and tokens, in document order. */
    public List<SyntaxElement> childrenWithTokens() {
        return Collections.unmodifiableList(elements);
    }

    /** Child nodes only, in document order. */
    public List<SyntaxNode> children() {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxElement e : elements) {
            if (e instanceof SyntaxNode) result.add((SyntaxNode) e);
        }
        return result;
    }

    public Optional<SyntaxNode> firstChildOfKind(SyntaxKind kind) {
        for (SyntaxElement e : elements) {
            if (e instanceof SyntaxNode && e.kind() == kind) return Optional.of((SyntaxNode) e);
        }
        return Optional.empty();
    }

    public List<SyntaxNode> childrenOfKind(SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxElement e : elements) {
            if (e instanceof SyntaxNode && e.kind() == kind) result.add((SyntaxNode) e);
        }
        return result;
    }

    /** Direct token children of the given kind (tokens of descendant nodes are not included). */
    public List<SyntaxToken> tokensOfKind(SyntaxKind kind) {
        List<SyntaxToken> result = new ArrayList<>();
        for (SyntaxElement e : elements) {
            if (e instanceof SyntaxToken && e.kind() == kind) result.add((SyntaxToken) e);
        }
        return result;
    }

    public Optional<SyntaxElement> firstChildOrToken() {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(0));
    }

    public Optional<SyntaxElement> lastChildOrToken() {
        return elements.isEmpty() ? Optional.empty() : Optional.of(elements.get(elements.size() - 1));
    }

    public SyntaxNode nextSibling() {
        SyntaxElement e = nextSiblingOrToken();
        while (e != null && !(e instanceof SyntaxNode)) e = e.nextSiblingOrToken();
        return (SyntaxNode) e;
    }

    public SyntaxNode prevSibling() {
        SyntaxElement e = prevSiblingOrToken();
        while (e != null && !(e instanceof SyntaxNode)) e = e.prevSiblingOrToken();
        return (SyntaxNode) e;
    }

    /**
     * Depth-first walk: enter this node, visit children and tokens in document order, exit.
     */
    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.enterNode(this);
        for (SyntaxElement child : elements) {
            child.accept(visitor);
        }
        visitor.exitNode(this);
    }

    @Override
    public String toString() {
        return kind() + "@" + range;
    }
}
