package io.mockdispatch.server;

import io.mockdispatch.core.error.DefinitionLoadException;
import io.mockdispatch.core.error.StoreException;
import io.mockdispatch.server.config.ConfigLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: {@code java -jar mock-dispatch-server.jar [--config mock-dispatch.yaml]}.
 *
 * <p>
 * Any startup failure is logged with what went wrong (configuration, definitions or record
 * store) and the process exits with status 1.
 */
public final class MockServerMain {

    private static final Logger LOG = LoggerFactory.getLogger(MockServerMain.class);

    static final int EXIT_STARTUP_FAILURE = 1;

    private MockServerMain() {}

    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        MockServerApp server;
        try {
            server = MockServerApp.start(args);
        } catch (RuntimeException e) {
            LOG.error(describe(e), e);
            System.exit(EXIT_STARTUP_FAILURE);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "mock-dispatch-shutdown"));
    }

    static String describe(RuntimeException e) {
        if (e instanceof ConfigLoadException) {
            return "Invalid configuration: " + e.getMessage();
        }
        if (e instanceof DefinitionLoadException load) {
            return "Cannot load mock definitions from " + load.source() + ": " + e.getMessage();
        }
        if (e instanceof StoreException) {
            return "Cannot open record store: " + e.getMessage();
        }
        return "Startup failed: " + e.getMessage();
    }
}
