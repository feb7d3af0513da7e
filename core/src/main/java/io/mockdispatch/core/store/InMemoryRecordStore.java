package io.mockdispatch.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Record store backed by a {@link ConcurrentHashMap}.
 *
 * <p>
 * Stored collections are immutable lists of records that are never handed out directly; every
 * read deep-copies. Updates run inside {@link ConcurrentHashMap#compute}, which serializes
 * writers per resource name while leaving other resources and all readers unblocked.
 */
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentHashMap<String, List<ObjectNode>> collections = new ConcurrentHashMap<>();

    @Override
    public Optional<List<ObjectNode>> get(String resourceName) {
        List<ObjectNode> stored = collections.get(resourceName);
        return stored == null ? Optional.empty() : Optional.of(copyOf(stored));
    }

    @Override
    public boolean exists(String resourceName) {
        return collections.containsKey(resourceName);
    }

    @Override
    public void replace(String resourceName, List<ObjectNode> records) {
        collections.put(resourceName, freeze(records));
    }

    @Override
    public <T> T update(String resourceName, CollectionMutation<T> mutation) {
        List<T> result = new ArrayList<>(1);
        collections.compute(resourceName, (name, stored) -> {
            List<ObjectNode> working = stored == null ? new ArrayList<>() : copyOf(stored);
            result.add(mutation.apply(working));
            return freeze(working);
        });
        return result.get(0);
    }

    @Override
    public boolean clear(String resourceName) {
        return collections.remove(resourceName) != null;
    }

    @Override
    public Set<String> resourceNames() {
        return Collections.unmodifiableSet(new TreeSet<>(collections.keySet()));
    }

    /** Snapshot of every collection, in name order. */
    public Map<String, List<ObjectNode>> snapshot() {
        Map<String, List<ObjectNode>> all = new LinkedHashMap<>();
        for (String name : resourceNames()) {
            get(name).ifPresent(records -> all.put(name, records));
        }
        return all;
    }

    private static List<ObjectNode> copyOf(List<ObjectNode> records) {
        List<ObjectNode> copy = new ArrayList<>(records.size());
        for (ObjectNode record : records) {
            copy.add(record.deepCopy());
        }
        return copy;
    }

    private static List<ObjectNode> freeze(List<ObjectNode> records) {
        return Collections.unmodifiableList(copyOf(records));
    }
}
