package io.mockdispatch.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.json.JsonNodeUtils;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * One filter clause from the query string. Either an operator clause ({@code age_gte=18}) or a
 * plain clause ({@code name=ann}) with type-dependent matching.
 *
 * @param field    record field under test
 * @param operator suffix operator, or null for a plain clause
 * @param value    raw query value
 */
public record FieldFilter(String field, FilterOperator operator, String value) implements Predicate<ObjectNode> {

    /** Parses a query key into a clause, splitting off a trailing operator suffix. */
    public static FieldFilter parse(String key, String value) {
        for (FilterOperator op : FilterOperator.values()) {
            String suffix = op.suffix();
            if (key.length() > suffix.length() && key.endsWith(suffix)) {
                return new FieldFilter(key.substring(0, key.length() - suffix.length()), op, value);
            }
        }
        return new FieldFilter(key, null, value);
    }

    @Override
    public boolean test(ObjectNode record) {
        JsonNode fieldValue = record.get(field);
        if (operator != null) {
            return operator.test(FilterValue.ofField(fieldValue), FilterValue.ofQuery(value));
        }
        return matchesPlain(fieldValue);
    }

    private boolean matchesPlain(JsonNode fieldValue) {
        if (!JsonNodeUtils.isPresent(fieldValue)) {
            return false;
        }
        if (fieldValue.isTextual()) {
            return containsIgnoreCase(fieldValue.textValue(), value);
        }
        if (fieldValue.isNumber()) {
            Double parsed = JsonNodeUtils.parseNumber(value);
            return parsed != null && Double.compare(fieldValue.doubleValue(), parsed) == 0;
        }
        if (fieldValue.isBoolean()) {
            return Boolean.toString(fieldValue.booleanValue()).equals(value.toLowerCase(Locale.ROOT));
        }
        if (fieldValue.isArray()) {
            for (JsonNode element : fieldValue) {
                if (element.isTextual()
                        ? containsIgnoreCase(element.textValue(), value)
                        : FilterValue.looseEquals(FilterValue.ofField(element), FilterValue.ofQuery(value))) {
                    return true;
                }
            }
            return false;
        }
        return value.equals(JsonNodeUtils.textForm(fieldValue));
    }

    private static boolean containsIgnoreCase(String haystack, String needle) {
        return haystack.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }
}
