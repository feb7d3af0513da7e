package io.mockdispatch.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed mapping from resource name to its ordered record collection.
 *
 * <p>
 * Reads return snapshots: callers may freely modify the returned records without affecting
 * stored state. Every read-modify-write goes through {@link #update(String, CollectionMutation)},
 * which implementations serialize per resource name so concurrent item mutations cannot lose
 * each other's changes.
 *
 * <p>
 * Implementations throw {@link io.mockdispatch.core.error.StoreException} when the underlying
 * persistence fails.
 */
public interface RecordStore {

    /** Snapshot of a collection, or empty when nothing has been stored under the name. */
    Optional<List<ObjectNode>> get(String resourceName);

    /** Whether a collection (possibly empty) exists under the name. */
    default boolean exists(String resourceName) {
        return get(resourceName).isPresent();
    }

    /** Replaces the whole collection, creating it when absent. */
    void replace(String resourceName, List<ObjectNode> records);

    /** Appends one record, creating the collection when absent. */
    default void append(String resourceName, ObjectNode record) {
        update(resourceName, records -> records.add(record.deepCopy()));
    }

    /** Snapshot of the record with the given {@code id}, if the collection holds one. */
    default Optional<ObjectNode> findItem(String resourceName, String id) {
        return get(resourceName).flatMap(records -> records.stream()
                .filter(r -> id.equals(r.path("id").asText(null)))
                .findFirst());
    }

    /**
     * Applies a read-modify-write atomically with respect to other updates of the same resource.
     *
     * @return the mutation's result
     */
    <T> T update(String resourceName, CollectionMutation<T> mutation);

    /**
     * Removes a collection entirely.
     *
     * @return {@code true} if a collection was removed
     */
    boolean clear(String resourceName);

    /** Names of all stored collections. */
    Set<String> resourceNames();
}
