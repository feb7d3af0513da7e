package io.mockdispatch.core.routing;

import io.mockdispatch.core.model.CustomApiDefinition;
import java.util.Map;
import java.util.Optional;

/**
 * One row of the route table: a custom API with its compiled path template.
 */
public record ApiRoute(CustomApiDefinition api, PathTemplate template) {

    public static ApiRoute of(CustomApiDefinition api) {
        return new ApiRoute(api, PathTemplate.compile(api.path()));
    }

    /**
     * Tests this row against a request: method equality, then an exact literal path match,
     * then the template.
     *
     * @return path parameter bindings, or empty when the row does not match
     */
    public Optional<Map<String, String>> match(String method, String path) {
        if (!api.method().equalsIgnoreCase(method)) {
            return Optional.empty();
        }
        if (api.path().equals(path)) {
            return Optional.of(Map.of());
        }
        return template.match(path);
    }
}
