package io.mockdispatch.core.conditional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body and status chosen for a custom API invocation.
 *
 * @param body       the response body; JSON null means no body
 * @param statusCode the response status
 * @param matched    whether a conditional rule's condition held; {@code false} also when no
 *                   rule is defined
 */
public record ConditionalOutcome(JsonNode body, int statusCode, boolean matched) {}
