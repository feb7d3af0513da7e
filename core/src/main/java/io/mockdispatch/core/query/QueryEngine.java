package io.mockdispatch.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.json.JsonNodeUtils;
import io.mockdispatch.core.store.RecordStore;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the collection query pipeline: filter, search, sort, paginate, embed, expand, always in
 * that order.
 *
 * <p>
 * The input collection is never modified. Records on the returned page are deep copies, so
 * attaching embedded or expanded relations does not touch stored state. Thread-safe.
 */
public final class QueryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

    private final RecordStore store;

    /**
     * @param store source of related collections for {@code _embed} and {@code _expand}
     */
    public QueryEngine(RecordStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Applies the directives to a collection.
     *
     * @param records      the collection snapshot
     * @param directives   parsed query directives
     * @param resourceName name of the queried collection, used to derive the embed foreign key
     */
    public QueryResult apply(List<ObjectNode> records, QueryDirectives directives, String resourceName) {
        List<ObjectNode> working = new ArrayList<>(records);

        for (FieldFilter filter : directives.filters()) {
            working.removeIf(filter.negate());
        }
        if (directives.search() != null) {
            working.removeIf(searchPredicate(directives.search()).negate());
        }
        if (!directives.sort().isEmpty()) {
            working.sort(new RecordComparator(directives.sort()));
        }

        int total = working.size();
        int limit = directives.limit();
        long start = (long) (directives.page() - 1) * limit;
        List<ObjectNode> page = new ArrayList<>();
        for (long i = start; i < Math.min(total, start + limit); i++) {
            page.add(working.get((int) i).deepCopy());
        }

        for (String child : directives.embed()) {
            embed(page, child, resourceName);
        }
        for (String parent : directives.expand()) {
            expand(page, parent);
        }

        LOG.debug(
                "Query on '{}': filters={}, total={}, page={}/{}",
                resourceName,
                directives.filters().size(),
                total,
                directives.page(),
                limit);
        return new QueryResult(page, PageMeta.of(directives.page(), limit, total));
    }

    private void embed(List<ObjectNode> page, String child, String resourceName) {
        Optional<List<ObjectNode>> related = store.get(child);
        if (related.isEmpty()) {
            return;
        }
        String foreignKey = Inflector.foreignKey(resourceName);
        for (ObjectNode record : page) {
            ArrayNode children = record.putArray(child);
            JsonNode id = record.get("id");
            for (ObjectNode candidate : related.get()) {
                if (sameId(candidate.get(foreignKey), id)) {
                    children.add(candidate);
                }
            }
        }
    }

    private void expand(List<ObjectNode> page, String parent) {
        Optional<List<ObjectNode>> related = store.get(parent);
        if (related.isEmpty()) {
            return;
        }
        String foreignKey = Inflector.foreignKey(parent);
        String target = Inflector.singularize(parent);
        for (ObjectNode record : page) {
            JsonNode reference = record.get(foreignKey);
            related.get().stream()
                    .filter(candidate -> sameId(candidate.get("id"), reference))
                    .findFirst()
                    .ifPresent(found -> record.set(target, found));
        }
    }

    /** Strict id equality: same JSON type and value. */
    private static boolean sameId(JsonNode left, JsonNode right) {
        return JsonNodeUtils.isPresent(left) && JsonNodeUtils.isPresent(right) && left.equals(right);
    }

    private static Predicate<ObjectNode> searchPredicate(String term) {
        String needle = term.toLowerCase(Locale.ROOT);
        return record -> {
            Iterator<JsonNode> fields = record.elements();
            while (fields.hasNext()) {
                JsonNode value = fields.next();
                if (value.isTextual() && value.textValue().toLowerCase(Locale.ROOT).contains(needle)) {
                    return true;
                }
                if (value.isNumber() && JsonNodeUtils.textForm(value).contains(needle)) {
                    return true;
                }
            }
            return false;
        };
    }
}
