package io.mockdispatch.core.store;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * A read-modify-write step applied to one record collection under the store's per-resource
 * serialization.
 *
 * <p>
 * The mutation receives a private, mutable working copy of the collection (empty when the
 * collection does not exist yet). The store persists the working copy after the mutation
 * returns. Throwing from the mutation leaves the stored collection untouched.
 *
 * @param <T> value handed back to the caller, e.g. the created or updated record
 */
@FunctionalInterface
public interface CollectionMutation<T> {

    T apply(List<ObjectNode> records);
}
