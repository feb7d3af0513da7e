package io.mockdispatch.core.model;

import java.util.Objects;

/**
 * One field of a {@link ResourceDefinition}.
 *
 * @param name       record key
 * @param type       value type
 * @param hint       generation hint such as {@code person.firstName}, or null
 * @param relationTo resource name a {@link FieldType#RELATION} field points to, or null
 * @param required   whether the field is declared as required
 */
public record FieldSpec(String name, FieldType type, String hint, String relationTo, boolean required) {

    public FieldSpec {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    /** Convenience factory for a field with no hint and no relation. */
    public static FieldSpec of(String name, FieldType type) {
        return new FieldSpec(name, type, null, null, false);
    }
}
