package io.hyperfoil.tools.select.tree;

import org.junit.Test;

import static org.junit.Assert.*;

public class SourceTextTest {

    @Test
    public void testPositionOf() {
        SourceText text = new SourceText("ab\ncd\n\nef");
        assertEquals(new Position(1, 1), text.positionOf(0));
        assertEquals(new Position(1, 3), text.positionOf(2));
        assertEquals(new Position(2, 1), text.positionOf(3));
        assertEquals(new Position(3, 1), text.positionOf(6));
        assertEquals(new Position(4, 2), text.positionOf(8));
        assertEquals(new Position(4, 3), text.positionOf(9));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testPositionOutsideText() {
        new SourceText("ab").positionOf(3);
    }

    @Test
    public void testEndPositionOfSingleLine() {
        SourceText text = new SourceText("(a b)");
        assertEquals(new Position(1, 5), text.endPositionOf(0, 5));
        assertEquals(new Position(1, 2), text.endPositionOf(1, 2));
    }

    @Test
    public void testEndPositionOfMultipleLines() {
        SourceText text = new SourceText("\"ab\ncd\"");
        assertEquals(new Position(2, 3), text.endPositionOf(0, 7));
    }

    @Test
    public void testEndPositionOfTrailingLineBreak() {
        SourceText text = new SourceText("(a)\n");
        assertEquals(new Position(2, 0), text.endPositionOf(0, 4));
    }

    @Test
    public void testEndPositionOfEmptySpan() {
        SourceText text = new SourceText("");
        assertEquals(new Position(1, 0), text.endPositionOf(0, 0));
    }

    @Test
    public void testPositionOrdering() {
        assertTrue(new Position(1, 9).isBefore(new Position(2, 1)));
        assertTrue(new Position(2, 1).isAtOrBefore(new Position(2, 1)));
        assertFalse(new Position(2, 2).isAtOrBefore(new Position(2, 1)));
        assertEquals(new Position(1, 1), Position.min(new Position(1, 1), new Position(1, 2)));
        assertEquals(new Position(3, 0), Position.max(new Position(3, 0), new Position(2, 7)));
    }
}
