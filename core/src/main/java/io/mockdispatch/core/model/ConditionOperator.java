package io.mockdispatch.core.model;

/** Comparison applied by a {@link Condition}. */
public enum ConditionOperator {
    EQUALS("equals"),
    NOT_EQUALS("notEquals"),
    CONTAINS("contains"),
    GREATER_THAN("greaterThan"),
    LESS_THAN("lessThan"),
    EXISTS("exists");

    private final String id;

    ConditionOperator(String id) {
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
    public static ConditionOperator fromId(String id) {
        for (ConditionOperator op : values()) {
            if (op.id.equals(id)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator: " + id);
    }
}
