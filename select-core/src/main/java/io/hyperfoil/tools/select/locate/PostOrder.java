package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.TreeCursor;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Every node under a starting cursor, descendants before ancestors and left before right,
 * ending with the starting node itself.
 * Iteration only moves the cursor (down to the leftmost leaf, then to the next sibling's
 * leftmost leaf or up to the parent), so it needs no stack and visits each node once.
 */
public final class PostOrder implements Iterable<TreeCursor> {

    private final TreeCursor start;

    private PostOrder(TreeCursor start) {
        this.start = start;
    }

    public static PostOrder of(TreeCursor start) {
        return new PostOrder(start);
    }

    @Override
    public Iterator<TreeCursor> iterator() {
        return new Iterator<>() {
            private TreeCursor next = start.bottom();

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public TreeCursor next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                TreeCursor current = next;
                next = advance(current);
                return current;
            }
        };
    }

    public Stream<TreeCursor> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    private TreeCursor advance(TreeCursor current) {
        if (current.depth() <= start.depth()) {
            return null;
        }
        TreeCursor right = current.right();
        if (right != null) {
            return right.bottom();
        }
        return current.up();
    }
}
