package io.mockdispatch.core.model;

/** Where a {@link Condition} reads the value it tests. */
public enum ConditionType {
    HEADER("header"),
    QUERY("query"),
    BODY("body"),
    DEPENDENT_API("dependentApi");

    private final String id;

    ConditionType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * Parses the identifier used in definition documents.
     *
     * @throws IllegalArgumentException for unknown identifiers
     */
    public static ConditionType fromId(String id) {
        for (ConditionType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown condition type: " + id);
    }
}
