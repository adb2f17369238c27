package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.Node;
import io.hyperfoil.tools.select.tree.Position;
import io.hyperfoil.tools.select.tree.TokenKind;
import io.hyperfoil.tools.select.tree.TreeCursor;

/**
 * How much of a located node ends up selected.
 */
public enum ExtentMode {

    /** The whole node, delimiters included */
    WHOLE("whole") {
        @Override
        public Extent extentOf(TreeCursor cursor) {
            return whole(cursor);
        }
    },

    /**
     * The node's content without its delimiters. Decorators and unquotes defer to what they
     * wrap; nodes without an interior, such as symbols and numbers, are selected whole.
     * An empty interior, as in {@code ()} or {@code ""}, has no extent.
     */
    INSIDE("inside") {
        @Override
        public Extent extentOf(TreeCursor cursor) {
            TreeCursor current = cursor;
            while (true) {
                switch (current.tag()) {
                    case LIST:
                    case MAP:
                    case MULTI_LINE:
                    case VECTOR:
                        return shrink(current, 1, 1);
                    case REGEX:
                    case SET:
                        return shrink(current, 2, 1);
                    case NAMESPACED_MAP:
                    case READER_MACRO:
                        current = payload(current);
                        break;
                    case SYNTAX_QUOTE:
                    case UNQUOTE:
                    case UNQUOTE_SPLICING:
                        current = child(current);
                        break;
                    case TOKEN:
                        if (current.node().getTokenKind() == TokenKind.STRING) {
                            return shrink(current, 1, 1);
                        }
                        return whole(current);
                    default:
                        return whole(current);
                }
            }
        }
    };

    private final String name;

    ExtentMode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the extent, or null when the node has an empty interior
     * @throws IllegalStateException when a wrapper node is missing the child it wraps
     */
    public abstract Extent extentOf(TreeCursor cursor);

    /**
     * {@link #INSIDE} for {@code "inside"}, {@link #WHOLE} for anything else including null.
     */
    public static ExtentMode fromName(String name) {
        return INSIDE.name.equals(name) ? INSIDE : WHOLE;
    }

    private static Extent whole(TreeCursor cursor) {
        return new Extent(cursor.position(), cursor.endPosition());
    }

    /**
     * Drops {@code startChars} columns from the first line and {@code endChars} columns from the
     * last line of the node's span.
     */
    private static Extent shrink(TreeCursor cursor, int startChars, int endChars) {
        Node node = cursor.node();
        Position start = node.getStart().shiftColumn(startChars);
        Position end = node.getEnd().shiftColumn(-endChars);
        if (end.isBefore(start)) {
            return null;
        }
        return new Extent(start, end);
    }

    private static TreeCursor payload(TreeCursor cursor) {
        TreeCursor payload = child(cursor).right();
        if (payload == null) {
            throw new IllegalStateException(cursor.tag() + " at " + cursor.position() + " has no payload");
        }
        return payload;
    }

    private static TreeCursor child(TreeCursor cursor) {
        TreeCursor child = cursor.down();
        if (child == null) {
            throw new IllegalStateException(cursor.tag() + " at " + cursor.position() + " has no children");
        }
        return child;
    }
}
