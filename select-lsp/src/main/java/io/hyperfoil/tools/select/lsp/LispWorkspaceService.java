package io.hyperfoil.tools.select.lsp;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.services.WorkspaceService;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Workspace service for the Lisp select server.
 * Client configuration under {@value #SECTION} overrides the selection range settings, e.g.
 * {@code {"lispSelect": {"selection-range.include-inside": false}}}.
 */
public class LispWorkspaceService implements WorkspaceService {

    private static final Logger LOG = Logger.getLogger(LispWorkspaceService.class.getName());

    public static final String SECTION = "lispSelect";

    private final ServerSettings settings;
    private final LispTextDocumentService textDocumentService;

    public LispWorkspaceService(ServerSettings settings, LispTextDocumentService textDocumentService) {
        this.settings = settings;
        this.textDocumentService = textDocumentService;
    }

    @Override
    public void didChangeConfiguration(DidChangeConfigurationParams params) {
        Object raw = params.getSettings();
        if (!(raw instanceof JsonObject)) {
            return;
        }
        JsonElement section = ((JsonObject) raw).get(SECTION);
        if (section == null || !section.isJsonObject()) {
            return;
        }
        Map<String, String> overrides = new HashMap<>();
        for (Map.Entry<String, JsonElement> entry : section.getAsJsonObject().entrySet()) {
            if (entry.getValue().isJsonPrimitive()) {
                overrides.put(entry.getKey(), entry.getValue().getAsString());
            }
        }
        LOG.info("Applying client settings " + overrides);
        textDocumentService.applySettings(settings.with(overrides));
    }

    @Override
    public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
        // Only open documents are read, and the client sends those in full
    }
}
