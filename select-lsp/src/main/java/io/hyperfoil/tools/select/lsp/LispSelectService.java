package io.hyperfoil.tools.select.lsp;

import io.hyperfoil.tools.select.LispDocument;
import io.hyperfoil.tools.select.locate.SelectRequest;
import io.hyperfoil.tools.select.locate.SelectResponse;
import io.hyperfoil.tools.select.locate.SelectionEngine;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Answers {@code lisp/select} with the {@link SelectionEngine}. Requests without code read the
 * open document named by their uri instead.
 */
public class LispSelectService implements SelectService {

    private static final Logger LOG = Logger.getLogger(LispSelectService.class.getName());

    private final SelectionEngine engine;
    private final LispTextDocumentService documents;

    public LispSelectService(SelectionEngine engine, LispTextDocumentService documents) {
        this.engine = engine;
        this.documents = documents;
    }

    @Override
    public CompletableFuture<SelectResult> select(SelectParams params) {
        return CompletableFuture.supplyAsync(() -> new SelectResult(answer(params)));
    }

    SelectResponse answer(SelectParams params) {
        SelectRequest request = params.toRequest();
        if (request.getCode() == null) {
            LispDocument doc = documents.getDocument(params.getUri());
            if (doc != null) {
                return engine.select(request, doc);
            }
            LOG.fine("No code and no open document for " + params.getUri());
        }
        return engine.select(request);
    }
}
