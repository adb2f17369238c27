package io.hyperfoil.tools.select.lsp;

import io.hyperfoil.tools.select.LispDocument;
import io.hyperfoil.tools.select.locate.Extent;
import io.hyperfoil.tools.select.locate.ExtentMode;
import io.hyperfoil.tools.select.locate.ObjectKind;
import io.hyperfoil.tools.select.locate.ObjectLocator;
import io.hyperfoil.tools.select.locate.Selection;
import io.hyperfoil.tools.select.tree.TreeCursor;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SelectionRange;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Provides textDocument/selectionRange for Lisp documents.
 * The chain starts at the element under the position and then alternates between the inside
 * of each enclosing form and the whole form, outward to the top level.
 * LSP positions are zero-based with an exclusive end; extents are ones-based and inclusive.
 */
public class SelectionRangeProvider {

    private static final Logger LOG = Logger.getLogger(SelectionRangeProvider.class.getName());

    private final ObjectLocator locator;
    private final int maxDepth;
    private final boolean includeInside;

    public SelectionRangeProvider(ServerSettings settings) {
        this(new ObjectLocator(), settings.getSelectionRangeMaxDepth(), settings.isSelectionRangeIncludeInside());
    }

    public SelectionRangeProvider(ObjectLocator locator, int maxDepth, boolean includeInside) {
        this.locator = locator;
        this.maxDepth = maxDepth;
        this.includeInside = includeInside;
    }

    public List<SelectionRange> selectionRanges(LispDocument doc, List<Position> positions) {
        List<SelectionRange> ranges = new ArrayList<>(positions.size());
        for (Position position : positions) {
            ranges.add(selectionRange(doc, position));
        }
        return ranges;
    }

    /**
     * Returns the innermost range around {@code position}, its parents linked outward.
     * A position that no object surrounds gets an empty range at the position.
     */
    public SelectionRange selectionRange(LispDocument doc, Position position) {
        SelectionRange range = null;
        try {
            List<Extent> chain = chain(doc, position);
            for (int i = chain.size() - 1; i >= 0; i--) {
                range = new SelectionRange(toRange(chain.get(i)), range);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.FINE, "Failed to build selection range at " + position, e);
            range = null;
        }
        if (range == null) {
            range = new SelectionRange(new Range(position, position), null);
        }
        return range;
    }

    /**
     * Extents around {@code position}, innermost first, each strictly enclosing the one before.
     */
    List<Extent> chain(LispDocument doc, Position position) {
        List<Extent> chain = new ArrayList<>();
        TreeCursor root = doc.cursor();
        if (root == null) {
            return chain;
        }
        Selection caret = toCaret(position);
        Selection selection = caret;

        TreeCursor element = locator.find(root, selection, ObjectKind.ELEMENT);
        if (element != null) {
            add(chain, ExtentMode.WHOLE.extentOf(element), caret);
        }
        if (!chain.isEmpty()) {
            selection = chain.get(0).toSelection();
        }
        while (chain.size() < maxDepth) {
            TreeCursor form = locator.find(root, selection, ObjectKind.FORM);
            if (form == null) {
                break;
            }
            if (includeInside) {
                add(chain, ExtentMode.INSIDE.extentOf(form), caret);
            }
            Extent whole = ExtentMode.WHOLE.extentOf(form);
            if (!add(chain, whole, caret)) {
                //the next form after the position, not one around it
                break;
            }
            selection = whole.toSelection();
        }
        while (chain.size() > maxDepth) {
            chain.remove(chain.size() - 1);
        }
        return chain;
    }

    /**
     * Appends {@code extent} if it covers the caret and strictly encloses the last extent.
     */
    private static boolean add(List<Extent> chain, Extent extent, Selection caret) {
        if (extent == null || !covers(extent, caret)) {
            return false;
        }
        if (!chain.isEmpty()) {
            Extent last = chain.get(chain.size() - 1);
            if (!extent.encloses(last) || extent.equals(last)) {
                return false;
            }
        }
        chain.add(extent);
        return true;
    }

    /** True if the caret sits on a character of the extent or right after its last one */
    private static boolean covers(Extent extent, Selection caret) {
        return extent.getStart().isAtOrBefore(caret.getCursor())
                && caret.getCursor().isAtOrBefore(extent.getEnd().shiftColumn(1));
    }

    /** A caret on the character an LSP position points at */
    static Selection toCaret(Position position) {
        return Selection.caret(position.getLine() + 1, position.getCharacter() + 1);
    }

    static Range toRange(Extent extent) {
        return new Range(
                new Position(extent.getStart().getLine() - 1, extent.getStart().getColumn() - 1),
                new Position(extent.getEnd().getLine() - 1, extent.getEnd().getColumn()));
    }
}
