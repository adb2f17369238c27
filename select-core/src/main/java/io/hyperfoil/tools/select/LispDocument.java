package io.hyperfoil.tools.select;

import io.hyperfoil.tools.select.parse.ParseException;
import io.hyperfoil.tools.select.parse.SourceParser;
import io.hyperfoil.tools.select.tree.Node;
import io.hyperfoil.tools.select.tree.TreeCursor;
import org.jboss.logging.Logger;

import java.lang.invoke.MethodHandles;

/**
 * A source text together with the tree read from it.
 * Reading happens once, in the constructor; a document never changes afterwards and a
 * failed read is recorded rather than thrown.
 */
public class LispDocument {

    private final static Logger logger = Logger.getLogger(MethodHandles.lookup().lookupClass());

    private final String uri;
    private final String text;
    private final Node root;
    private final ParseException parseError;

    public LispDocument(String text) {
        this(null, text);
    }

    public LispDocument(String uri, String text) {
        this.uri = uri;
        this.text = text == null ? "" : text;
        Node parsed = null;
        ParseException error = null;
        try {
            parsed = SourceParser.parse(this.text);
        } catch (ParseException e) {
            logger.debugf("failed to read %s: %s", uri == null ? "source" : uri, e.getMessage());
            error = e;
        }
        this.root = parsed;
        this.parseError = error;
    }

    public String getUri() {
        return uri;
    }

    public String getText() {
        return text;
    }

    public boolean isParseSuccessful() {
        return root != null;
    }

    /** The {@code forms} root, null when reading failed */
    public Node getRoot() {
        return root;
    }

    public ParseException getParseError() {
        return parseError;
    }

    /** A cursor at the root, null when reading failed */
    public TreeCursor cursor() {
        return root == null ? null : TreeCursor.of(root);
    }
}
