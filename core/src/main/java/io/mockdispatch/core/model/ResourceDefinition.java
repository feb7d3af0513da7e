package io.mockdispatch.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A virtual CRUD collection served under its {@code name}.
 *
 * @param id     definition id
 * @param name   public collection segment and record store key
 * @param fields ordered field schema
 * @param seed   number of records to generate at startup when the collection is absent
 */
public record ResourceDefinition(String id, String name, List<FieldSpec> fields, int seed) {

    public ResourceDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    public ResourceDefinition(String id, String name, List<FieldSpec> fields) {
        this(id, name, fields, 0);
    }
}
