package io.mockdispatch.server.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mockdispatch.core.definition.DefinitionRepository;
import io.mockdispatch.core.store.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@code DELETE {admin}/resources/{name}/records}: drops a resource's stored collection. */
public final class ClearRecordsHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(ClearRecordsHandler.class);

    private final DefinitionRepository definitions;
    private final RecordStore store;

    public ClearRecordsHandler(DefinitionRepository definitions, RecordStore store) {
        this.definitions = definitions;
        this.store = store;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        String name = ctx.pathParam("name");
        if (definitions.current().findResource(name).isEmpty()) {
            JsonResponses.error(ctx, 404, "Resource not found");
            return;
        }
        boolean removed = store.clear(name);
        LOG.info("Cleared records of resource '{}' (existed={})", name, removed);
        ObjectNode response = JsonResponses.MAPPER.createObjectNode();
        response.put("success", true);
        JsonResponses.json(ctx, 200, response);
    }
}
