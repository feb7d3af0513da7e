package io.mockdispatch.core.routing;

import io.mockdispatch.core.model.CustomApiDefinition;
import io.mockdispatch.core.model.ResourceDefinition;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link RouteResolver#resolve}: exactly one of a custom API match, a resource match
 * or a not-found outcome carrying diagnostic hints.
 */
public sealed interface RouteMatch {

    /**
     * A custom API handles the request.
     *
     * @param api        the first matching definition in declaration order
     * @param pathParams parameter bindings from the path template
     */
    record CustomApiMatch(CustomApiDefinition api, Map<String, String> pathParams) implements RouteMatch {}

    /**
     * A resource collection handles the request.
     *
     * @param resource the resource named by the first path segment
     * @param itemId   the second path segment, or null for the collection endpoint
     */
    record ResourceMatch(ResourceDefinition resource, String itemId) implements RouteMatch {

        public boolean isItem() {
            return itemId != null;
        }
    }

    /**
     * Nothing handles the request.
     *
     * @param availableResources names of all known resources
     * @param availableApis      {@code "METHOD path"} signatures of all known custom APIs
     */
    record NotFound(List<String> availableResources, List<String> availableApis) implements RouteMatch {

        public NotFound {
            availableResources = List.copyOf(availableResources);
            availableApis = List.copyOf(availableApis);
        }
    }
}
