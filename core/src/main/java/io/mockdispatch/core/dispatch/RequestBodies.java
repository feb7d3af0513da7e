package io.mockdispatch.core.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.mockdispatch.core.error.InvalidRequestBodyException;
import io.mockdispatch.core.model.MockRequest;

/** Parsing of raw request bodies. Stateless utility class. */
final class RequestBodies {

    static final String NOT_AN_OBJECT = "Request body must be a JSON object";

    private RequestBodies() {}

    /**
     * Body of a mutating request. An empty body counts as {@code {}}.
     *
     * @throws InvalidRequestBodyException if the body is not a JSON object
     */
    static ObjectNode requireObject(ObjectMapper mapper, MockRequest request) {
        if (!request.hasBody()) {
            return mapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = mapper.readTree(request.body());
        } catch (JsonProcessingException e) {
            throw new InvalidRequestBodyException(NOT_AN_OBJECT, e);
        }
        if (node == null || !node.isObject()) {
            throw new InvalidRequestBodyException(NOT_AN_OBJECT);
        }
        return (ObjectNode) node;
    }

    /** Body as JSON when it parses, null when it does not or is empty. */
    static JsonNode parseOrNull(ObjectMapper mapper, MockRequest request) {
        if (!request.hasBody()) {
            return null;
        }
        try {
            return mapper.readTree(request.body());
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /** Body as JSON when it parses, otherwise the raw text; null when empty. */
    static JsonNode parseOrText(ObjectMapper mapper, MockRequest request) {
        JsonNode parsed = parseOrNull(mapper, request);
        if (parsed == null && request.hasBody()) {
            return TextNode.valueOf(request.body());
        }
        return parsed;
    }
}
