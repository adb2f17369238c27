package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.Position;
import io.hyperfoil.tools.select.tree.TreeCursor;
import org.junit.Test;

import static io.hyperfoil.tools.select.TreeTestSupport.find;
import static io.hyperfoil.tools.select.TreeTestSupport.root;
import static org.junit.Assert.*;

public class ExtentModeTest {

    private static Extent extent(int startLine, int startColumn, int endLine, int endColumn) {
        return new Extent(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    private static Extent inside(String code, String text) {
        return ExtentMode.INSIDE.extentOf(find(root(code), text));
    }

    @Test
    public void testFromName() {
        assertEquals(ExtentMode.INSIDE, ExtentMode.fromName("inside"));
        assertEquals(ExtentMode.WHOLE, ExtentMode.fromName("whole"));
        assertEquals(ExtentMode.WHOLE, ExtentMode.fromName(null));
        assertEquals(ExtentMode.WHOLE, ExtentMode.fromName("around"));
    }

    @Test
    public void testWholeCoversDelimiters() {
        assertEquals(extent(1, 1, 1, 7), ExtentMode.WHOLE.extentOf(find(root("(+ 1 2)"), "(+ 1 2)")));
        assertEquals(extent(1, 4, 1, 4), ExtentMode.WHOLE.extentOf(find(root("(+ 1 2)"), "1")));
    }

    @Test
    public void testInsideDelimitedForms() {
        assertEquals(extent(1, 2, 1, 6), inside("(+ 1 2)", "(+ 1 2)"));
        assertEquals(extent(1, 2, 1, 4), inside("[1 2]", "[1 2]"));
        assertEquals(extent(1, 2, 1, 5), inside("{:a 1}", "{:a 1}"));
        assertEquals(extent(1, 3, 1, 5), inside("#{1 2}", "#{1 2}"));
    }

    @Test
    public void testInsideStringsAndRegexes() {
        assertEquals(extent(1, 2, 1, 4), inside("\"abc\"", "\"abc\""));
        assertEquals(extent(1, 3, 1, 4), inside("#\"a+\"", "#\"a+\""));
        assertEquals(extent(1, 2, 2, 2), inside("\"ab\ncd\"", "\"ab\ncd\""));
    }

    @Test
    public void testInsideStringEndingWithNewline() {
        assertEquals(extent(1, 2, 2, 0), inside("\"ab\n\"", "\"ab\n\""));
    }

    @Test
    public void testInsideDefersToPayload() {
        assertEquals(extent(1, 5, 1, 8), inside("#:a{:b 1}", "#:a{:b 1}"));
        assertEquals(extent(1, 4, 1, 9), inside("#?(:clj 1)", "#?(:clj 1)"));
        assertEquals(extent(1, 8, 1, 11), inside("#inst \"2020\"", "#inst \"2020\""));
    }

    @Test
    public void testInsideDefersToQuotedForm() {
        assertEquals(extent(1, 3, 1, 6), inside("`(a ~b)", "`(a ~b)"));
        assertEquals(extent(1, 2, 1, 2), inside("~b", "~b"));
    }

    @Test
    public void testInsideWithoutInteriorIsWhole() {
        assertEquals(extent(1, 1, 1, 3), inside("foo", "foo"));
        assertEquals(extent(1, 1, 1, 2), inside(":k", ":k"));
        assertEquals(extent(1, 1, 1, 4), inside("'(a)", "'(a)"));
        assertEquals(extent(1, 1, 1, 5), inside("^:k x", "^:k x"));
    }

    @Test
    public void testEmptyInteriorHasNoExtent() {
        assertNull(inside("()", "()"));
        assertNull(inside("[]", "[]"));
        assertNull(inside("\"\"", "\"\""));
    }

    @Test
    public void testWholeIsInsidePlusDelimiters() {
        String code = String.join("\n",
                "(let [m {:a #{1 2}}",
                "      re #\"\\d+\"]",
                "  (str \"x\" m \"two",
                "lines\"))");
        String[] texts = {
                "[m {:a #{1 2}}\n      re #\"\\d+\"]",
                "{:a #{1 2}}",
                "#{1 2}",
                "#\"\\d+\"",
                "(str \"x\" m \"two\nlines\")",
                "\"x\"",
                "\"two\nlines\""
        };
        for (String text : texts) {
            TreeCursor cursor = find(root(code), text);
            Extent inside = ExtentMode.INSIDE.extentOf(cursor);
            String open = opening(cursor);
            String close = text.substring(text.length() - 1);
            assertEquals(text, open + slice(code, inside) + close);
        }
    }

    private static String opening(TreeCursor cursor) {
        switch (cursor.tag()) {
            case REGEX:
                return "#\"";
            case TOKEN:
            case MULTI_LINE:
                return "\"";
            default:
                return cursor.tag().getOpen();
        }
    }

    /** Source covered by an inclusive extent */
    private static String slice(String code, Extent extent) {
        return code.substring(offset(code, extent.getStart()), offset(code, extent.getEnd()) + 1);
    }

    private static int offset(String code, Position position) {
        int lineStart = 0;
        for (int line = 1; line < position.getLine(); line++) {
            lineStart = code.indexOf('\n', lineStart) + 1;
        }
        return lineStart + position.getColumn() - 1;
    }
}
