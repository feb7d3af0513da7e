package io.mockdispatch.core.model;

import java.util.Locale;

/** Value type of a resource field; drives record generation. */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    EMAIL,
    UUID,
    IMAGE,
    RELATION;

    /** Lower-case identifier used in definition documents. */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a definition-document identifier ({@code "string"}, {@code "relation"}, ...).
     *
     * @throws IllegalArgumentException if the identifier is not a known field type
     */
    public static FieldType fromId(String id) {
        if (id != null) {
            for (FieldType type : values()) {
                if (type.id().equalsIgnoreCase(id.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + id);
    }
}
