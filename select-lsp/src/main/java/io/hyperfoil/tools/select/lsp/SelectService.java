package io.hyperfoil.tools.select.lsp;

import org.eclipse.lsp4j.jsonrpc.services.JsonRequest;
import org.eclipse.lsp4j.jsonrpc.services.JsonSegment;

import java.util.concurrent.CompletableFuture;

/**
 * The {@code lisp/select} request: grow an editor selection to the next element, form or
 * top level form.
 */
@JsonSegment("lisp")
public interface SelectService {

    @JsonRequest
    CompletableFuture<SelectResult> select(SelectParams params);
}
