package io.hyperfoil.tools.select.lsp;

import io.hyperfoil.tools.select.locate.SelectionEngine;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.jsonrpc.services.JsonDelegate;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;

import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Lisp select language server.
 * Provides textDocument/selectionRange and the {@code lisp/select} request for Clojure and other
 * Lisp sources.
 */
public class LispLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger LOG = Logger.getLogger(LispLanguageServer.class.getName());

    private final ServerSettings settings;
    private final LispTextDocumentService textDocumentService;
    private final LispWorkspaceService workspaceService;
    private final LispSelectService selectService;
    private int errorCode = 1;

    public LispLanguageServer() {
        this(ServerSettings.load());
    }

    public LispLanguageServer(ServerSettings settings) {
        this.settings = settings;
        this.textDocumentService = new LispTextDocumentService(settings);
        this.workspaceService = new LispWorkspaceService(settings, textDocumentService);
        this.selectService = new LispSelectService(new SelectionEngine(), textDocumentService);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        ServerCapabilities capabilities = new ServerCapabilities();

        // Text document sync - full document sync
        capabilities.setTextDocumentSync(TextDocumentSyncKind.Full);

        // Expand / shrink selection
        capabilities.setSelectionRangeProvider(true);

        InitializeResult result = new InitializeResult(capabilities);
        result.setServerInfo(new ServerInfo(settings.getServerName(), settings.getServerVersion()));

        LOG.info(settings.getServerName() + " initialized");
        return CompletableFuture.completedFuture(result);
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        errorCode = 0;
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void exit() {
        System.exit(errorCode);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return textDocumentService;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return workspaceService;
    }

    @JsonDelegate
    public SelectService getSelectService() {
        return selectService;
    }

    @Override
    public void connect(LanguageClient client) {
        LOG.info("Language client connected");
    }
}
