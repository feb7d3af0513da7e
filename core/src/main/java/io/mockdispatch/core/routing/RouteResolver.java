package io.mockdispatch.core.routing;

import io.mockdispatch.core.definition.DefinitionRegistry;
import io.mockdispatch.core.model.ResourceDefinition;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which definition handles a request.
 *
 * <p>
 * Precedence, evaluated top to bottom:
 * <ol>
 * <li>Custom APIs, in declaration order. The first row whose method is equal and whose path
 * matches (literally or as a template) wins. Overlapping templates resolve by declaration
 * order, not by specificity.</li>
 * <li>A resource named by the first path segment. The second segment, if present and not the
 * literal {@code undefined}, is the item id.</li>
 * <li>Otherwise {@link RouteMatch.NotFound} with the known resources and API signatures.</li>
 * </ol>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RouteResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RouteResolver.class);

    /** Placeholder some clients send for an unset item id. */
    static final String UNDEFINED_SEGMENT = "undefined";

    /**
     * Resolves a request against a definitions snapshot.
     *
     * @param method   the HTTP method
     * @param path     the path relative to the mount prefix
     * @param registry the definitions snapshot
     * @return the match, never null
     */
    public RouteMatch resolve(String method, String path, DefinitionRegistry registry) {
        for (ApiRoute route : registry.routes()) {
            Optional<Map<String, String>> params = route.match(method, path);
            if (params.isPresent()) {
                LOG.debug("{} {} matched custom API '{}' ({})", method, path, route.api().id(), route.template());
                return new RouteMatch.CustomApiMatch(route.api(), params.get());
            }
        }

        List<String> segments = PathTemplate.split(path);
        if (!segments.isEmpty()) {
            Optional<ResourceDefinition> resource = registry.findResource(segments.get(0));
            if (resource.isPresent()) {
                String itemId = segments.size() > 1 && !UNDEFINED_SEGMENT.equals(segments.get(1))
                        ? segments.get(1)
                        : null;
                LOG.debug("{} {} matched resource '{}' (item={})", method, path, resource.get().name(), itemId);
                return new RouteMatch.ResourceMatch(resource.get(), itemId);
            }
        }

        return new RouteMatch.NotFound(registry.resourceNames(), registry.apiSignatures());
    }
}
