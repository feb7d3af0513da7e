package io.mockdispatch.core.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.error.ItemNotFoundException;
import io.mockdispatch.core.model.MockRequest;
import io.mockdispatch.core.model.MockResponse;
import io.mockdispatch.core.query.QueryDirectives;
import io.mockdispatch.core.query.QueryEngine;
import io.mockdispatch.core.query.QueryResult;
import io.mockdispatch.core.routing.RouteMatch;
import io.mockdispatch.core.store.RecordStore;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * CRUD over one resource collection.
 *
 * <p>
 * Item mutations run inside {@link RecordStore#update}, so concurrent writes to the same
 * resource are serialized. Returns {@link Optional#empty()} for method and path combinations
 * a resource does not serve; the caller answers those with a not-found response.
 */
final class ResourceRequestHandler {

    static final String NO_DATA = "No data generated for this resource yet";

    private static final Set<String> ITEM_METHODS = Set.of("GET", "PUT", "PATCH", "DELETE");

    private final RecordStore store;
    private final QueryEngine queryEngine;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final Supplier<String> idGenerator;
    private final int defaultLimit;

    ResourceRequestHandler(
            RecordStore store,
            QueryEngine queryEngine,
            ObjectMapper mapper,
            Clock clock,
            Supplier<String> idGenerator,
            int defaultLimit) {
        this.store = store;
        this.queryEngine = queryEngine;
        this.mapper = mapper;
        this.clock = clock;
        this.idGenerator = idGenerator;
        this.defaultLimit = defaultLimit;
    }

    Optional<MockResponse> handle(MockRequest request, RouteMatch.ResourceMatch match) {
        String name = match.resource().name();
        if (match.isItem()) {
            Optional<MockResponse> item = handleItem(request, name, match.itemId());
            if (item.isPresent()) {
                return item;
            }
        }
        return handleCollection(request, name);
    }

    private Optional<MockResponse> handleItem(MockRequest request, String name, String id) {
        if (!ITEM_METHODS.contains(request.method())) {
            return Optional.empty();
        }
        if (!store.exists(name)) {
            return Optional.of(MockResponse.error(404, NO_DATA));
        }
        switch (request.method()) {
            case "GET":
                return Optional.of(MockResponse.ok(store.findItem(name, id)
                        .orElseThrow(() -> new ItemNotFoundException(name, id))));
            case "PUT":
            case "PATCH":
                ObjectNode changes = RequestBodies.requireObject(mapper, request);
                ObjectNode merged = store.update(name, records -> {
                    int index = indexOf(records, id);
                    if (index < 0) {
                        throw new ItemNotFoundException(name, id);
                    }
                    ObjectNode updated = records.get(index).deepCopy();
                    JsonNode storedId = updated.get("id");
                    updated.setAll(changes);
                    updated.set("id", storedId);
                    records.set(index, updated);
                    return updated.deepCopy();
                });
                return Optional.of(MockResponse.ok(merged));
            case "DELETE":
                store.update(name, records -> {
                    int index = indexOf(records, id);
                    if (index < 0) {
                        throw new ItemNotFoundException(name, id);
                    }
                    return records.remove(index);
                });
                ObjectNode success = JsonNodeFactory.instance.objectNode();
                success.put("success", true);
                return Optional.of(MockResponse.ok(success));
            default:
                throw new IllegalStateException("Unexpected item method " + request.method());
        }
    }

    private Optional<MockResponse> handleCollection(MockRequest request, String name) {
        switch (request.method()) {
            case "GET":
                Optional<List<ObjectNode>> records = store.get(name);
                if (records.isEmpty()) {
                    return Optional.of(MockResponse.error(404, NO_DATA));
                }
                QueryResult result = queryEngine.apply(
                        records.get(), QueryDirectives.parse(request.queryParams(), defaultLimit), name);
                return Optional.of(MockResponse.ok(result.toJson()));
            case "POST":
                ObjectNode body = RequestBodies.requireObject(mapper, request);
                ObjectNode created = JsonNodeFactory.instance.objectNode();
                String id = idGenerator.get();
                created.put("id", id);
                created.setAll(body);
                created.put("id", id);
                created.put("createdAt", clock.instant().toString());
                store.append(name, created);
                return Optional.of(MockResponse.json(201, created));
            default:
                return Optional.empty();
        }
    }

    private static int indexOf(List<ObjectNode> records, String id) {
        for (int i = 0; i < records.size(); i++) {
            if (id.equals(records.get(i).path("id").asText(null))) {
                return i;
            }
        }
        return -1;
    }

    static Supplier<String> randomUuids() {
        return () -> UUID.randomUUID().toString();
    }
}
