package io.mockdispatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of dispatching a {@link MockRequest}: a status code and an optional JSON body.
 * A {@code null} body means the response is written without a body.
 */
public final class MockResponse {

    private final int statusCode;
    private final JsonNode body;

    private MockResponse(int statusCode, JsonNode body) {
        this.statusCode = statusCode;
        this.body = body;
    }

    /** JSON response. A JSON {@code null} body is treated as "no body". */
    public static MockResponse json(int statusCode, JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return new MockResponse(statusCode, null);
        }
        return new MockResponse(statusCode, body);
    }

    /** 200 JSON response. */
    public static MockResponse ok(JsonNode body) {
        return json(200, body);
    }

    /** Response without a body. */
    public static MockResponse empty(int statusCode) {
        return new MockResponse(statusCode, null);
    }

    /** {@code {"error": message}} at the given status. */
    public static MockResponse error(int statusCode, String message) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", message);
        return new MockResponse(statusCode, node);
    }

    public int statusCode() {
        return statusCode;
    }

    /** The response body, or {@code null} when no body is emitted. */
    public JsonNode body() {
        return body;
    }

    public boolean hasBody() {
        return body != null;
    }

    @Override
    public String toString() {
        return "MockResponse[status=" + statusCode + (body != null ? ", body=" + body : ", no body") + "]";
    }
}
