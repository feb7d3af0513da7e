package io.mockdispatch.server.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.mockdispatch.core.model.MockResponse;

/** Writes JSON bodies to a Javalin {@link Context}. Stateless utility class. */
final class JsonResponses {

    static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonResponses() {}

    /** Writes a dispatcher response; a response without a body writes only the status. */
    static void write(Context ctx, MockResponse response) throws JsonProcessingException {
        ctx.status(response.statusCode());
        if (response.hasBody()) {
            json(ctx, response.statusCode(), response.body());
        }
    }

    static void json(Context ctx, int status, JsonNode body) throws JsonProcessingException {
        ctx.status(status);
        ctx.contentType("application/json");
        ctx.result(MAPPER.writeValueAsString(body));
    }

    /** {@code {"error": message}} at the given status. */
    static void error(Context ctx, int status, String message) throws JsonProcessingException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("error", message);
        json(ctx, status, body);
    }
}
