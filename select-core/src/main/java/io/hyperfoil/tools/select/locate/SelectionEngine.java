package io.hyperfoil.tools.select.locate;

import io.hyperfoil.tools.select.LispDocument;
import io.hyperfoil.tools.select.tree.Position;
import io.hyperfoil.tools.select.tree.TreeCursor;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;

/**
 * Answers select requests: reads the code once, then grows the selection one object at a time,
 * feeding each round's extent into the next round as the selection.
 * Requests share nothing, so one engine can serve any number of threads.
 */
public class SelectionEngine {

    private final static Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final ObjectLocator locator;

    public SelectionEngine() {
        this(new ObjectLocator());
    }

    public SelectionEngine(ObjectLocator locator) {
        this.locator = locator;
    }

    /**
     * Never throws. Malformed code, bad parameters and internal failures all come back as the
     * empty response, the same as finding nothing.
     */
    public SelectResponse select(SelectRequest request) {
        try {
            return run(request);
        } catch (Exception | StackOverflowError e) {
            logger.debugf(e, "%s failed", request);
            return SelectResponse.empty();
        }
    }

    /**
     * Like {@link #select(SelectRequest)} but reads from an already parsed document instead of
     * the request's code.
     */
    public SelectResponse select(SelectRequest request, LispDocument document) {
        try {
            return run(request, document);
        } catch (Exception | StackOverflowError e) {
            logger.debugf(e, "%s failed", request);
            return SelectResponse.empty();
        }
    }

    /**
     * One round: locate the {@code kind} object for {@code selection} and measure it.
     *
     * @return the extent to select next, or null when there is nothing to select
     */
    public Extent expand(TreeCursor root, Selection selection, ObjectKind kind, ExtentMode mode) {
        TreeCursor target = locator.find(root, selection, kind);
        if (target == null) {
            return null;
        }
        return mode.extentOf(target);
    }

    private SelectResponse run(SelectRequest request) {
        return run(request, new LispDocument(request.getCode()));
    }

    private SelectResponse run(SelectRequest request, LispDocument document) {
        ObjectKind kind = ObjectKind.fromName(request.getKind());
        if (kind == null) {
            logger.debugf("unknown object kind %s", request.getKind());
            return SelectResponse.empty();
        }
        if (request.getCursorLine() == null || request.getCursorColumn() == null) {
            logger.debugf("%s has no cursor", request);
            return SelectResponse.empty();
        }
        if (!document.isParseSuccessful()) {
            return SelectResponse.empty();
        }
        ExtentMode mode = ExtentMode.fromName(request.getExtent());
        Position cursor = new Position(request.getCursorLine(), request.getCursorColumn());
        Selection selection = request.hasAnchor()
                ? Selection.of(cursor, new Position(request.getAnchorLine(), request.getAnchorColumn()))
                : Selection.caret(cursor);

        int rounds = Math.max(1, request.getCount() == null ? 1 : request.getCount());
        TreeCursor root = document.cursor();
        Extent extent = null;
        for (int round = 0; round < rounds; round++) {
            Extent next = expand(root, selection, kind, mode);
            if (next == null) {
                logger.tracef("round %d of %s found nothing", round + 1, request);
                return SelectResponse.empty();
            }
            if (next.equals(extent)) {
                //the remaining rounds would select the same extent again
                break;
            }
            extent = next;
            selection = extent.toSelection();
        }
        return SelectResponse.of(extent);
    }
}
