package io.hyperfoil.tools.select.tree;

import java.util.Arrays;

/**
 * Source text shared by every node of one tree, with a line index for
 * converting character offsets into ones-based positions.
 */
public final class SourceText {

    private final String text;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        int count = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        this.lineStarts = new int[count];
        int line = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
    }

    public String substring(int start, int end) {
        return text.substring(start, end);
    }

    /**
     * Returns the position of the character at {@code offset}. An offset equal to the
     * text length maps to the position just after the last character.
     */
    public Position positionOf(int offset) {
        if (offset < 0 || offset > text.length()) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + text.length() + "]");
        }
        int index = Arrays.binarySearch(lineStarts, offset);
        int lineIndex = index >= 0 ? index : -index - 2;
        return new Position(lineIndex + 1, offset - lineStarts[lineIndex] + 1);
    }

    /**
     * Position of the last character of the span {@code [start, end)}.
     * A span ending with a line break ends in column 0 of the following line, and an
     * empty span ends one column before it starts.
     */
    public Position endPositionOf(int start, int end) {
        if (end <= start) {
            return positionOf(start).shiftColumn(-1);
        }
        int last = end - 1;
        if (text.charAt(last) == '\n') {
            Position p = positionOf(last);
            return new Position(p.getLine() + 1, 0);
        }
        return positionOf(last);
    }
}
