package io.hyperfoil.tools.select.tree;

import java.util.List;

/**
 * An immutable zipper over a source tree.
 * A cursor is a node plus the path of (parent cursor, child index) frames that lead to it, so
 * moving never mutates the tree and a cursor can be kept while others move on.
 * Navigation steps over trivia (whitespace, newlines, commas and comments) and returns
 * {@code null} when there is nowhere to go.
 */
public final class TreeCursor {

    private final Node node;
    private final TreeCursor parent;
    private final int index;
    private final int depth;

    private TreeCursor(Node node, TreeCursor parent, int index) {
        this.node = node;
        this.parent = parent;
        this.index = index;
        this.depth = parent == null ? 0 : parent.depth + 1;
    }

    public static TreeCursor of(Node root) {
        return new TreeCursor(root, null, -1);
    }

    public Node node() {
        return node;
    }

    public Tag tag() {
        return node.getTag();
    }

    public Object value() {
        return node.getValue();
    }

    public String string() {
        return node.getString();
    }

    public Position position() {
        return node.getStart();
    }

    public Position endPosition() {
        return node.getEnd();
    }

    /** Number of frames between this cursor and the root */
    public int depth() {
        return depth;
    }

    public TreeCursor up() {
        return parent;
    }

    /** The first non-trivia child */
    public TreeCursor down() {
        List<Node> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).isTrivia()) {
                return new TreeCursor(children.get(i), this, i);
            }
        }
        return null;
    }

    /** The next non-trivia sibling */
    public TreeCursor right() {
        if (parent == null) {
            return null;
        }
        List<Node> siblings = parent.node.getChildren();
        for (int i = index + 1; i < siblings.size(); i++) {
            if (!siblings.get(i).isTrivia()) {
                return new TreeCursor(siblings.get(i), parent, i);
            }
        }
        return null;
    }

    /** Follows {@link #down()} until reaching a node without non-trivia children */
    public TreeCursor bottom() {
        TreeCursor current = this;
        TreeCursor next = current.down();
        while (next != null) {
            current = next;
            next = current.down();
        }
        return current;
    }

    /** Tag of the parent node, null at the root */
    public Tag parentTag() {
        return parent == null ? null : parent.tag();
    }

    @Override
    public String toString() {
        return "TreeCursor{" + node + ", depth=" + depth + "}";
    }
}
