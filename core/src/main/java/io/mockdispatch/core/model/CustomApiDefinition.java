package io.mockdispatch.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A user-declared fixed endpoint: method + path template + canned response.
 *
 * @param id                  definition id, unique within a registry
 * @param name                display name, may be null
 * @param method              upper-case HTTP method
 * @param path                literal path or template with {@code :param} segments
 * @param statusCode          status emitted on match
 * @param responseBody        body emitted on match; JSON null means "no body"
 * @param webhookUrl          URL notified on every invocation, or null
 * @param queryParams         documented query parameters (never enforced)
 * @param conditionalResponse optional rule overriding body and status
 */
public record CustomApiDefinition(
        String id,
        String name,
        String method,
        String path,
        int statusCode,
        JsonNode responseBody,
        String webhookUrl,
        List<QueryParamSpec> queryParams,
        ConditionalResponseRule conditionalResponse) {

    /** HTTP methods a custom API may declare. */
    public static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS", "HEAD");

    public CustomApiDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        responseBody = responseBody == null ? NullNode.getInstance() : responseBody;
        queryParams = queryParams == null ? List.of() : List.copyOf(queryParams);
    }

    /** Minimal definition with a static response and no webhook or rule. */
    public static CustomApiDefinition of(String id, String method, String path, int statusCode, JsonNode body) {
        return new CustomApiDefinition(id, null, method, path, statusCode, body, null, List.of(), null);
    }

    /** {@code "METHOD path"} signature used in not-found hints. */
    public String signature() {
        return method + " " + path;
    }

    public boolean hasWebhook() {
        return webhookUrl != null && !webhookUrl.isBlank();
    }
}
