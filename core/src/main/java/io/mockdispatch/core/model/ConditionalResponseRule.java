package io.mockdispatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Objects;

/**
 * Chooses between two canned responses of a custom API.
 *
 * @param condition         the test
 * @param responseIfTrue    body emitted when the condition holds (JSON null → empty body)
 * @param responseIfFalse   body emitted otherwise
 * @param statusCodeIfTrue  status override for the true branch, or null for the API's own status
 * @param statusCodeIfFalse status override for the false branch, or null
 */
public record ConditionalResponseRule(
        Condition condition,
        JsonNode responseIfTrue,
        JsonNode responseIfFalse,
        Integer statusCodeIfTrue,
        Integer statusCodeIfFalse) {

    public ConditionalResponseRule {
        Objects.requireNonNull(condition, "condition must not be null");
        responseIfTrue = responseIfTrue == null ? NullNode.getInstance() : responseIfTrue;
        responseIfFalse = responseIfFalse == null ? NullNode.getInstance() : responseIfFalse;
    }
}
