package io.hyperfoil.tools.select.lsp;

import io.hyperfoil.tools.select.LispDocument;
import io.hyperfoil.tools.select.locate.Extent;
import io.hyperfoil.tools.select.locate.ObjectLocator;
import io.hyperfoil.tools.select.locate.Selection;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SelectionRange;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class SelectionRangeProviderTest {

    private static final String DEFN = String.join("\n",
            "(defn f [x]",
            "  (inc x))"
    );

    private SelectionRangeProvider provider;

    @Before
    public void setUp() {
        provider = new SelectionRangeProvider(new ObjectLocator(), 64, true);
    }

    private static Range range(int startLine, int startChar, int endLine, int endChar) {
        return new Range(new Position(startLine, startChar), new Position(endLine, endChar));
    }

    private static List<Range> ranges(SelectionRange selectionRange) {
        List<Range> ranges = new ArrayList<>();
        for (SelectionRange current = selectionRange; current != null; current = current.getParent()) {
            ranges.add(current.getRange());
        }
        return ranges;
    }

    @Test
    public void testChainFromElementOutward() {
        SelectionRange result = provider.selectionRange(new LispDocument(DEFN), new Position(1, 7));
        assertEquals(List.of(
                range(1, 7, 1, 8),
                range(1, 3, 1, 8),
                range(1, 2, 1, 9),
                range(0, 1, 1, 9),
                range(0, 0, 1, 10)
        ), ranges(result));
    }

    @Test
    public void testWithoutInsideRanges() {
        provider = new SelectionRangeProvider(new ObjectLocator(), 64, false);
        SelectionRange result = provider.selectionRange(new LispDocument(DEFN), new Position(1, 7));
        assertEquals(List.of(
                range(1, 7, 1, 8),
                range(1, 2, 1, 9),
                range(0, 0, 1, 10)
        ), ranges(result));
    }

    @Test
    public void testMaxDepth() {
        provider = new SelectionRangeProvider(new ObjectLocator(), 2, true);
        SelectionRange result = provider.selectionRange(new LispDocument(DEFN), new Position(1, 7));
        assertEquals(List.of(range(1, 7, 1, 8), range(1, 3, 1, 8)), ranges(result));
    }

    @Test
    public void testEachParentEnclosesItsChild() {
        String code = "(ns a)\n\n(let [m {:k #{1 2}}]\n  (str \"v\" m))";
        LispDocument doc = new LispDocument(code);
        for (Position position : List.of(new Position(2, 14), new Position(3, 8), new Position(3, 11), new Position(2, 6))) {
            SelectionRange current = provider.selectionRange(doc, position);
            while (current.getParent() != null) {
                Range child = current.getRange();
                Range parent = current.getParent().getRange();
                assertTrue(parent + " should enclose " + child, encloses(parent, child) && !parent.equals(child));
                current = current.getParent();
            }
        }
    }

    @Test
    public void testOpeningDelimiter() {
        SelectionRange result = provider.selectionRange(new LispDocument("(a b)"), new Position(0, 0));
        assertEquals(List.of(range(0, 0, 0, 5)), ranges(result));
    }

    @Test
    public void testWhitespaceInsideForm() {
        SelectionRange result = provider.selectionRange(new LispDocument("(foo bar)"), new Position(0, 4));
        assertEquals(List.of(range(0, 1, 0, 8), range(0, 0, 0, 9)), ranges(result));
    }

    @Test
    public void testWhitespaceBetweenToplevelForms() {
        SelectionRange result = provider.selectionRange(new LispDocument("(a)  (b)"), new Position(0, 4));
        assertEquals(List.of(range(0, 4, 0, 4)), ranges(result));
    }

    @Test
    public void testUnreadableDocument() {
        SelectionRange result = provider.selectionRange(new LispDocument("(a"), new Position(0, 1));
        assertEquals(List.of(range(0, 1, 0, 1)), ranges(result));
    }

    @Test
    public void testOneRangePerPosition() {
        List<SelectionRange> result = provider.selectionRanges(new LispDocument(DEFN),
                List.of(new Position(0, 1), new Position(1, 7), new Position(5, 0)));
        assertEquals(3, result.size());
        assertEquals(range(0, 1, 0, 5), result.get(0).getRange());
        assertEquals(range(1, 7, 1, 8), result.get(1).getRange());
        assertEquals(range(5, 0, 5, 0), result.get(2).getRange());
    }

    @Test
    public void testPositionConversion() {
        assertEquals(Selection.caret(3, 5), SelectionRangeProvider.toCaret(new Position(2, 4)));
        Extent extent = new Extent(Selection.caret(1, 2).getCursor(), Selection.caret(2, 3).getCursor());
        assertEquals(range(0, 1, 1, 3), SelectionRangeProvider.toRange(extent));
    }

    private static boolean encloses(Range outer, Range inner) {
        return !isBefore(inner.getStart(), outer.getStart()) && !isBefore(outer.getEnd(), inner.getEnd());
    }

    private static boolean isBefore(Position a, Position b) {
        return a.getLine() < b.getLine() || (a.getLine() == b.getLine() && a.getCharacter() < b.getCharacter());
    }
}
