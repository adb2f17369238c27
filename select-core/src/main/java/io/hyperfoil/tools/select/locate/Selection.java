package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.Node;
import io.hyperfoil.tools.select.tree.Position;

import java.util.Objects;

/**
 * The range an editor currently has selected: a cursor and an anchor in either order.
 * Both ends are inclusive character positions. A selection without an anchor is a caret,
 * which sits at the cursor and covers no characters.
 */
public final class Selection {

    private final Position cursor;
    private final Position anchor;

    private Selection(Position cursor, Position anchor) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.anchor = anchor;
    }

    public static Selection caret(Position cursor) {
        return new Selection(cursor, null);
    }

    public static Selection caret(int line, int column) {
        return caret(new Position(line, column));
    }

    public static Selection of(Position cursor, Position anchor) {
        return new Selection(cursor, Objects.requireNonNull(anchor, "anchor"));
    }

    public Position getCursor() {
        return cursor;
    }

    /** The anchor, or the cursor for a caret */
    public Position getAnchor() {
        return anchor == null ? cursor : anchor;
    }

    public boolean isCaret() {
        return anchor == null;
    }

    public Position getStart() {
        return Position.min(cursor, getAnchor());
    }

    public Position getEnd() {
        return Position.max(cursor, getAnchor());
    }

    /** True if every character of {@code node} is already selected */
    public boolean contains(Node node) {
        return !isCaret()
                && getStart().isAtOrBefore(node.getStart())
                && node.getEnd().isAtOrBefore(getEnd());
    }

    /** True if this selection lies within {@code node} without covering exactly the same span */
    public boolean isInside(Node node) {
        Position start = getStart();
        Position end = getEnd();
        return node.getStart().isAtOrBefore(start)
                && end.isAtOrBefore(node.getEnd())
                && (!start.equals(node.getStart()) || !end.equals(node.getEnd()));
    }

    /**
     * A node the selection may grow to: it must not end before the cursor, and it must not be
     * selected already.
     */
    public boolean isAcceptable(Node node) {
        return cursor.isAtOrBefore(node.getEnd()) && !contains(node);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Selection)) {
            return false;
        }
        Selection other = (Selection) o;
        return cursor.equals(other.cursor) && Objects.equals(anchor, other.anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cursor, anchor);
    }

    @Override
    public String toString() {
        return isCaret() ? "caret " + cursor : cursor + "-" + anchor;
    }
}
