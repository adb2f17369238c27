package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.Tag;
import io.hyperfoil.tools.select.tree.TreeCursor;

/**
 * The granularities a selection can grow to.
 * Classification only looks at the tags on the path around a node, so it gives the same answer
 * every time it is asked about the same node.
 */
public enum ObjectKind {

    /**
     * A value leaf, with any metadata or reader macro around it. The decorator stands for its
     * payload, so the payload itself is not reported again.
     */
    ELEMENT("element") {
        @Override
        public boolean matches(TreeCursor cursor) {
            Tag parent = cursor.parentTag();
            if (parent != null && parent.isDecorator()) {
                return false;
            }
            TreeCursor current = cursor;
            while (current != null && current.tag().isDecorator()) {
                current = payload(current);
            }
            return current != null && current.tag().isObjectLeaf();
        }
    },

    /**
     * A list, map, set or vector, with any decorators or quoting around it.
     */
    FORM("form") {
        @Override
        public boolean matches(TreeCursor cursor) {
            Tag parent = cursor.parentTag();
            if (parent != null && (parent.isDecorator() || parent.isQuoting())) {
                return false;
            }
            TreeCursor current = cursor;
            while (current != null) {
                Tag tag = current.tag();
                if (tag.isDecorator()) {
                    current = payload(current);
                } else if (tag.isQuoting()) {
                    current = current.down();
                } else {
                    return tag.isContainer();
                }
            }
            return false;
        }
    },

    /**
     * A form directly under the document root.
     */
    TOPLEVEL("toplevel") {
        @Override
        public boolean matches(TreeCursor cursor) {
            Tag parent = cursor.parentTag();
            return FORM.matches(cursor) && (parent == null || parent == Tag.FORMS);
        }
    };

    private final String name;

    ObjectKind(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract boolean matches(TreeCursor cursor);

    /**
     * Looks up a kind by the name editors send, e.g. {@code toplevel}.
     *
     * @return the kind, or null for an unknown name
     */
    public static ObjectKind fromName(String name) {
        for (ObjectKind kind : values()) {
            if (kind.name.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    /** Second child of a decorator */
    private static TreeCursor payload(TreeCursor decorator) {
        TreeCursor marker = decorator.down();
        return marker == null ? null : marker.right();
    }
}
