package com.rusttrace.syntax;

/**
 * Half-open byte interval {@code [start, end)} into the UTF-8 encoding of a source file.
 */
public record TextRange(int start, int end) {

    public TextRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid text range: " + start + ".." + end);
        }
    }

    public int length() {
        return end - start;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
