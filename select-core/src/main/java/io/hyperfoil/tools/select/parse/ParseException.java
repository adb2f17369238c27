package io.hyperfoil.tools.select.parse;

import io.hyperfoil.tools.select.tree.Position;

/**
 * Thrown when source text cannot be read into a tree.
 */
public class ParseException extends Exception {

    private final Position position;

    public ParseException(String message, Position position) {
        super(message + " at " + position);
        this.position = position;
    }

    /** Where the reader was when it gave up */
    public Position getPosition() {
        return position;
    }
}
