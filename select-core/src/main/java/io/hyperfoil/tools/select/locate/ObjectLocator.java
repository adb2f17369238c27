package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.tree.TreeCursor;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;

/**
 * Picks the node a selection should grow to.
 */
public class ObjectLocator {

    private final static Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    /**
     * Walks the tree in post-order, so inner nodes come before the nodes around them, and
     * returns the first node of {@code kind} that the selection sits strictly inside. When the
     * selection is inside none of them, the first node of {@code kind} it may grow to at all is
     * returned instead, e.g. the next element after a caret in whitespace.
     *
     * @return the target node, or null when no node of {@code kind} is acceptable
     */
    public TreeCursor find(TreeCursor root, Selection selection, ObjectKind kind) {
        TreeCursor firstAcceptable = null;
        for (TreeCursor candidate : PostOrder.of(root)) {
            if (!kind.matches(candidate) || !selection.isAcceptable(candidate.node())) {
                continue;
            }
            if (selection.isInside(candidate.node())) {
                logger.tracef("%s %s encloses %s", kind.getName(), candidate.node(), selection);
                return candidate;
            }
            if (firstAcceptable == null) {
                firstAcceptable = candidate;
            }
        }
        if (firstAcceptable != null) {
            logger.tracef("no %s encloses %s, using %s", kind.getName(), selection, firstAcceptable.node());
        }
        return firstAcceptable;
    }
}
