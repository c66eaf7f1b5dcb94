package com.rusttrace.adapter.static_analysis;

import java.nio.charset.StandardCharsets;

/**
 * Reconstructs line/column positions from byte offsets.
 *
 * The syntax tree only records byte ranges, so lines are counted while the walk passes over
 * tokens. {@link #positionOf} is correct only after every newline-bearing token before the
 * offset has been fed to {@link #advance}; a depth-first, left-to-right walk guarantees that
 * for keyword tokens.
 */
public class LocationTracker {

    /** A 1-based line and the byte distance from the last line break. */
    public record Position(int line, int column) {}

    private int currentLine = 1;
    private int lastLinebreakOffset = 0;

    /**
     * Accounts for the newlines in a token.
     *
     * @param text        token text
     * @param startOffset absolute byte offset of the token
     */
    public void advance(String text, int startOffset) {
        int lastNewline = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                currentLine++;
                lastNewline = i;
            }
        }
        if (lastNewline >= 0) {
            int byteIndex = text.substring(0, lastNewline).getBytes(StandardCharsets.UTF_8).length;
            lastLinebreakOffset = startOffset + byteIndex;
        }
    }

    public Position positionOf(int byteOffset) {
        return new Position(currentLine, byteOffset - lastLinebreakOffset);
    }

    public int currentLine() {
        return currentLine;
    }
}
