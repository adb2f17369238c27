package io.hyperfoil.tools.select.lsp;

import io.hyperfoil.tools.select.LispDocument;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.SelectionRange;
import org.eclipse.lsp4j.SelectionRangeParams;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.services.TextDocumentService;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Text document service for Lisp sources.
 * Keeps a parsed {@link LispDocument} per open file and answers selection range requests from it.
 */
public class LispTextDocumentService implements TextDocumentService {

    private static final Logger LOG = Logger.getLogger(LispTextDocumentService.class.getName());

    private final Map<String, LispDocument> documents = new ConcurrentHashMap<>();
    private volatile SelectionRangeProvider selectionRangeProvider;

    public LispTextDocumentService(ServerSettings settings) {
        applySettings(settings);
    }

    public void applySettings(ServerSettings settings) {
        this.selectionRangeProvider = new SelectionRangeProvider(settings);
    }

    /**
     * @return the open document for {@code uri}, or null if the client has not opened it
     */
    public LispDocument getDocument(String uri) {
        return uri == null ? null : documents.get(uri);
    }

    @Override
    public void didOpen(DidOpenTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        update(uri, params.getTextDocument().getText());
    }

    @Override
    public void didChange(DidChangeTextDocumentParams params) {
        String uri = params.getTextDocument().getUri();
        List<TextDocumentContentChangeEvent> changes = params.getContentChanges();
        if (!changes.isEmpty()) {
            // Full document sync, the last change holds the whole text
            update(uri, changes.get(changes.size() - 1).getText());
        }
    }

    @Override
    public void didClose(DidCloseTextDocumentParams params) {
        documents.remove(params.getTextDocument().getUri());
    }

    @Override
    public void didSave(DidSaveTextDocumentParams params) {
        if (params.getText() != null) {
            update(params.getTextDocument().getUri(), params.getText());
        }
    }

    @Override
    public CompletableFuture<List<SelectionRange>> selectionRange(SelectionRangeParams params) {
        return CompletableFuture.supplyAsync(() -> {
            String uri = params.getTextDocument().getUri();
            LispDocument doc = documents.get(uri);
            if (doc == null) {
                doc = new LispDocument(uri, "");
            }
            return selectionRangeProvider.selectionRanges(doc, params.getPositions());
        });
    }

    private void update(String uri, String text) {
        LispDocument doc = new LispDocument(uri, text);
        documents.put(uri, doc);
        if (!doc.isParseSuccessful()) {
            LOG.fine("Cannot read " + uri + ": " + doc.getParseError().getMessage());
        }
    }
}
