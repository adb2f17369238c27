package io.hyperfoil.tools.select.tree;

import java.util.Objects;

/**
 * A ones-based (line, column) location in source text.
 * Positions order by line first, then by column.
 */
public final class Position implements Comparable<Position> {

    private final int line;
    private final int column;

    public Position(int line, int column) {
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean isBefore(Position other) {
        return compareTo(other) < 0;
    }

    public boolean isAtOrBefore(Position other) {
        return compareTo(other) <= 0;
    }

    /**
     * Moves the column by {@code delta} without changing the line.
     */
    public Position shiftColumn(int delta) {
        return new Position(line, column + delta);
    }

    public static Position min(Position a, Position b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static Position max(Position a, Position b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    @Override
    public int compareTo(Position other) {
        if (line != other.line) {
            return Integer.compare(line, other.line);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Position)) {
            return false;
        }
        Position other = (Position) o;
        return line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column);
    }

    @Override
    public String toString() {
        return "[" + line + " " + column + "]";
    }
}
