package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.Position;

import java.util.Objects;

/**
 * A span of source from {@code start} to {@code end}, both inclusive.
 */
public final class Extent {

    private final Position start;
    private final Position end;

    public Extent(Position start, Position end) {
        this.start = start;
        this.end = end;
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    /** True if {@code other} lies within this extent; equal extents enclose each other */
    public boolean encloses(Extent other) {
        return start.isAtOrBefore(other.start) && other.end.isAtOrBefore(end);
    }

    /** The selection an editor shows for this extent: cursor at the start, anchor at the end */
    public Selection toSelection() {
        return Selection.of(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Extent)) {
            return false;
        }
        Extent other = (Extent) o;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
