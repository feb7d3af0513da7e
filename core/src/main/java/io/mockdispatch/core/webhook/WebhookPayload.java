package io.mockdispatch.core.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * JSON document POSTed to a custom API's webhook URL.
 *
 * @param method the invoking request's method
 * @param path   the invoking request's path
 * @param body   the invoking request's body; JSON null for GET
 */
public record WebhookPayload(String method, String path, JsonNode body) {

    public WebhookPayload {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        body = body == null || "GET".equals(method) ? NullNode.getInstance() : body;
    }

    /** {@code {"method": ..., "path": ..., "body": ...}}. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("method", method);
        node.put("path", path);
        node.set("body", body);
        return node;
    }
}
