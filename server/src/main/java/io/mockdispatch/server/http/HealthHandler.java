package io.mockdispatch.server.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.definition.DefinitionRepository;

/**
 * {@code GET {health}}: {@code {"status":"UP","apis":N,"resources":M}} with the size of the
 * definitions snapshot currently served. Lives outside the base path, so no mock can shadow it.
 */
public final class HealthHandler implements Handler {

    private final DefinitionRepository definitions;

    public HealthHandler(DefinitionRepository definitions) {
        this.definitions = definitions;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        DefinitionRegistry snapshot = definitions.current();
        ObjectNode body = JsonResponses.MAPPER.createObjectNode();
        body.put("status", "UP");
        body.put("apis", snapshot.apis().size());
        body.put("resources", snapshot.resources().size());
        JsonResponses.json(ctx, 200, body);
    }
}
