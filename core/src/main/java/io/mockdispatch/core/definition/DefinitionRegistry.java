package io.mockdispatch.core.definition;

import io.mockdispatch.core.model.CustomApiDefinition;
import io.mockdispatch.core.model.ResourceDefinition;
import io.mockdispatch.core.routing.ApiRoute;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of all custom API and resource definitions.
 *
 * <p>
 * This is the unit of atomic swap in {@link FileDefinitionRepository#reload()}. The repository
 * holds the current snapshot in an {@link java.util.concurrent.atomic.AtomicReference};
 * requests capture one snapshot and use it throughout, so a reload never changes the
 * definitions under an in-flight request.
 *
 * <p>
 * Custom APIs keep their declaration order; it is the route table's precedence order.
 */
public final class DefinitionRegistry {

    private static final DefinitionRegistry EMPTY = new DefinitionRegistry(List.of(), List.of());

    private final List<CustomApiDefinition> apis;
    private final List<ResourceDefinition> resources;
    private final List<ApiRoute> routes;
    private final Map<String, CustomApiDefinition> apisById;
    private final Map<String, ResourceDefinition> resourcesByName;

    /**
     * Creates a registry. Both lists are defensively copied.
     *
     * @param apis      custom APIs in declaration order
     * @param resources resources in declaration order
     */
    public DefinitionRegistry(List<CustomApiDefinition> apis, List<ResourceDefinition> resources) {
        this.apis = List.copyOf(apis);
        this.resources = List.copyOf(resources);

        List<ApiRoute> table = new ArrayList<>(this.apis.size());
        Map<String, CustomApiDefinition> byId = new LinkedHashMap<>();
        for (CustomApiDefinition api : this.apis) {
            table.add(ApiRoute.of(api));
            byId.putIfAbsent(api.id(), api);
        }
        Map<String, ResourceDefinition> byName = new LinkedHashMap<>();
        for (ResourceDefinition resource : this.resources) {
            byName.putIfAbsent(resource.name(), resource);
        }
        this.routes = Collections.unmodifiableList(table);
        this.apisById = Collections.unmodifiableMap(byId);
        this.resourcesByName = Collections.unmodifiableMap(byName);
    }

    /** A registry with no definitions. */
    public static DefinitionRegistry empty() {
        return EMPTY;
    }

    /** Custom APIs in declaration order. */
    public List<CustomApiDefinition> apis() {
        return apis;
    }

    /** Resources in declaration order. */
    public List<ResourceDefinition> resources() {
        return resources;
    }

    /** The route table: one compiled row per custom API, in declaration order. */
    public List<ApiRoute> routes() {
        return routes;
    }

    public Optional<CustomApiDefinition> findApi(String id) {
        return Optional.ofNullable(id == null ? null : apisById.get(id));
    }

    public Optional<ResourceDefinition> findResource(String name) {
        return Optional.ofNullable(name == null ? null : resourcesByName.get(name));
    }

    /** Names of all resources, in declaration order. */
    public List<String> resourceNames() {
        return List.copyOf(resourcesByName.keySet());
    }

    /** {@code "METHOD path"} signatures of all custom APIs, in declaration order. */
    public List<String> apiSignatures() {
        return apis.stream().map(CustomApiDefinition::signature).toList();
    }

    @Override
    public String toString() {
        return "DefinitionRegistry[apis=" + apis.size() + ", resources=" + resources.size() + "]";
    }
}
