package io.hyperfoil.tools.select.tree;

import java.util.Collections;
import java.util.List;

/**
 * An immutable node of a lossless source tree.
 * A node spans {@code [start, end)} of its {@link SourceText}; for branch nodes that span is
 * the tag's opening text, every child's span in order, then the tag's closing text.
 */
public final class Node {

    private final Tag tag;
    private final SourceText source;
    private final int start;
    private final int end;
    private final List<Node> children;
    private final TokenKind tokenKind;
    private final Object value;
    private final Position startPosition;
    private final Position endPosition;

    private Node(Tag tag, SourceText source, int start, int end, List<Node> children, TokenKind tokenKind, Object value) {
        this.tag = tag;
        this.source = source;
        this.start = start;
        this.end = end;
        this.children = children;
        this.tokenKind = tokenKind;
        this.value = value;
        this.startPosition = source.positionOf(start);
        this.endPosition = source.endPositionOf(start, end);
    }

    public static Node leaf(Tag tag, SourceText source, int start, int end) {
        return new Node(tag, source, start, end, Collections.emptyList(), null, source.substring(start, end));
    }

    public static Node token(TokenKind kind, Object value, SourceText source, int start, int end) {
        return new Node(Tag.TOKEN, source, start, end, Collections.emptyList(), kind, value);
    }

    /**
     * A leaf whose value differs from its source text, e.g. a multi-line string or a regex.
     */
    public static Node leaf(Tag tag, Object value, SourceText source, int start, int end) {
        return new Node(tag, source, start, end, Collections.emptyList(), null, value);
    }

    public static Node branch(Tag tag, SourceText source, int start, int end, List<Node> children) {
        return new Node(tag, source, start, end, List.copyOf(children), null, null);
    }

    public Tag getTag() {
        return tag;
    }

    public List<Node> getChildren() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty() && tag.getOpen().isEmpty();
    }

    /**
     * The kind of a {@link Tag#TOKEN}, null for every other tag.
     */
    public TokenKind getTokenKind() {
        return tokenKind;
    }

    /**
     * The value of a leaf: decoded content for strings, regexes and multi-line strings, a
     * {@link Number} for numbers, a {@link Character} for characters and the source text for
     * symbols, keywords and trivia. Null for branch nodes.
     */
    public Object getValue() {
        return value;
    }

    public boolean isTrivia() {
        return tag.isTrivia();
    }

    /** The exact source text this node spans */
    public String getString() {
        return source.substring(start, end);
    }

    public Position getStart() {
        return startPosition;
    }

    /** Position of the last character of this node */
    public Position getEnd() {
        return endPosition;
    }

    @Override
    public String toString() {
        return tag.getName() + startPosition + "-" + endPosition;
    }
}
