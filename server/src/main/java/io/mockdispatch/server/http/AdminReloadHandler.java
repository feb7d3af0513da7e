package io.mockdispatch.server.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.definition.FileDefinitionRepository;
import io.mockdispatch.core.error.DefinitionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /admin/reload}: re-reads the definitions file and swaps the registry.
 *
 * <p>
 * Success answers {@code 200 {"status":"reloaded","apis":N,"resources":M}}. A broken file
 * answers 500 with {@code {"error": ...}} and the previous definitions stay active.
 */
public final class AdminReloadHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(AdminReloadHandler.class);

    private final FileDefinitionRepository definitions;

    public AdminReloadHandler(FileDefinitionRepository definitions) {
        this.definitions = definitions;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        LOG.info("Admin reload triggered via POST {}", ctx.path());
        try {
            DefinitionRegistry registry = definitions.reload();
            ObjectNode response = JsonResponses.MAPPER.createObjectNode();
            response.put("status", "reloaded");
            response.put("apis", registry.apis().size());
            response.put("resources", registry.resources().size());
            JsonResponses.json(ctx, 200, response);
        } catch (DefinitionLoadException e) {
            LOG.error("Reload failed: {}", e.getMessage(), e);
            JsonResponses.error(ctx, 500, "Reload failed: " + e.getMessage());
        }
    }
}
