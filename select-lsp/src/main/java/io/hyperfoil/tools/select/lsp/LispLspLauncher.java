package io.hyperfoil.tools.select.lsp;

import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts the Lisp select language server on stdin/stdout.
 */
public class LispLspLauncher {

    private static final Logger LOG = Logger.getLogger(LispLspLauncher.class.getName());

    public static void main(String[] args) {
        InputStream in = System.in;
        OutputStream out = System.out;

        // stdout carries JSON-RPC, anything else printed goes to stderr
        System.setOut(System.err);

        LispLanguageServer server = new LispLanguageServer();
        Launcher<LanguageClient> launcher = LSPLauncher.createServerLauncher(server, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<?> listening = launcher.startListening();
        LOG.info("Lisp select language server is listening");
        try {
            listening.get();
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Lisp select language server stopped", e);
        }
    }
}
