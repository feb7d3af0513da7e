package io.mockdispatch.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mockdispatch.core.definition.DefinitionRepository;
import io.mockdispatch.core.generate.RecordGenerator;
import io.mockdispatch.core.model.ResourceDefinition;
import io.mockdispatch.core.store.RecordStore;
import java.util.List;
import java.util.Optional;

/**
 * {@code POST {admin}/resources/{name}/generate}: replaces a resource's collection with fresh
 * generated records.
 *
 * <p>
 * Body {@code {"count": N}}, N in {@code 1..1000}, defaulting to 10. Answers
 * {@code {"success":true,"count":N,"data":[...]}}.
 */
public final class GenerateRecordsHandler implements Handler {

    static final int DEFAULT_COUNT = 10;

    private final DefinitionRepository definitions;
    private final RecordStore store;
    private final RecordGenerator generator;

    public GenerateRecordsHandler(DefinitionRepository definitions, RecordStore store, RecordGenerator generator) {
        this.definitions = definitions;
        this.store = store;
        this.generator = generator;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        Optional<ResourceDefinition> resource = definitions.current().findResource(ctx.pathParam("name"));
        if (resource.isEmpty()) {
            JsonResponses.error(ctx, 404, "Resource not found");
            return;
        }

        int count;
        try {
            count = requestedCount(ctx.body());
        } catch (JsonProcessingException | NumberFormatException e) {
            JsonResponses.error(ctx, 400, "count must be an integer between 1 and " + RecordGenerator.MAX_COUNT);
            return;
        }
        if (count < 1 || count > RecordGenerator.MAX_COUNT) {
            JsonResponses.error(ctx, 400, "count must be an integer between 1 and " + RecordGenerator.MAX_COUNT);
            return;
        }

        List<ObjectNode> records = generator.generateInto(store, resource.get(), count);
        ObjectNode response = JsonResponses.MAPPER.createObjectNode();
        response.put("success", true);
        response.put("count", records.size());
        ArrayNode data = response.putArray("data");
        records.forEach(data::add);
        JsonResponses.json(ctx, 200, response);
    }

    private static int requestedCount(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return DEFAULT_COUNT;
        }
        JsonNode count = JsonResponses.MAPPER.readTree(body).path("count");
        if (count.isMissingNode() || count.isNull()) {
            return DEFAULT_COUNT;
        }
        if (count.isIntegralNumber()) {
            if (!count.canConvertToInt()) {
                throw new NumberFormatException("count out of int range: " + count.asText());
            }
            return count.intValue();
        }
        return Integer.parseInt(count.asText().trim());
    }
}
