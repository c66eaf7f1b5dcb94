package com.rusttrace.syntax;

/**
 * Leaf of the syntax tree: a single lexed token with its source text.
 */
public final class SyntaxToken extends SyntaxElement {

    private final String text;
    private final TextRange range;

    SyntaxToken(SyntaxKind kind, String text, int startOffset, int byteLength) {
        super(kind);
        this.text = text;
        this.range = new TextRange(startOffset, startOffset + byteLength);
    }

    @Override
    public TextRange textRange() { return range; }

    @Override
    public String text() { return text; }

    @Override
    public void accept(SyntaxVisitor visitor) {
        visitor.visitToken(this);
    }

    @Override
    public String toString() {
        return kind() + "@" + range + " " + text;
    }
}
