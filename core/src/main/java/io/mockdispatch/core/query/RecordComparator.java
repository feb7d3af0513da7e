package io.mockdispatch.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mockdispatch.core.json.JsonNodeUtils;
import java.util.Comparator;
import java.util.List;

/**
 * Multi-key record ordering for {@code _sort}/{@code _order}.
 *
 * <p>
 * A missing or null value sorts after every defined value whatever the direction; two missing
 * values tie and the next key decides. Fields mixing numbers, booleans and text still sort
 * consistently, see {@link #compareValues}. Used with {@link List#sort}, which is stable.
 */
final class RecordComparator implements Comparator<ObjectNode> {

    private final List<QueryDirectives.SortKey> keys;

    RecordComparator(List<QueryDirectives.SortKey> keys) {
        this.keys = List.copyOf(keys);
    }

    @Override
    public int compare(ObjectNode a, ObjectNode b) {
        for (QueryDirectives.SortKey key : keys) {
            JsonNode left = a.get(key.field());
            JsonNode right = b.get(key.field());
            boolean leftPresent = JsonNodeUtils.isPresent(left);
            boolean rightPresent = JsonNodeUtils.isPresent(right);
            if (!leftPresent || !rightPresent) {
                if (leftPresent != rightPresent) {
                    return leftPresent ? -1 : 1;
                }
                continue;
            }
            int cmp = compareValues(left, right);
            if (cmp != 0) {
                return key.descending() ? -cmp : cmp;
            }
        }
        return 0;
    }

    /**
     * Total order over defined values: numbers and numeric strings first (numerically), then
     * booleans (false before true), then everything else by text form.
     */
    static int compareValues(JsonNode left, JsonNode right) {
        Double leftNumber = JsonNodeUtils.asNumber(left);
        Double rightNumber = JsonNodeUtils.asNumber(right);
        int rank = Integer.compare(rank(left, leftNumber), rank(right, rightNumber));
        if (rank != 0) {
            return rank;
        }
        if (leftNumber != null) {
            return Double.compare(leftNumber, rightNumber);
        }
        if (left.isBoolean()) {
            return Boolean.compare(left.booleanValue(), right.booleanValue());
        }
        return JsonNodeUtils.textForm(left).compareTo(JsonNodeUtils.textForm(right));
    }

    private static int rank(JsonNode node, Double number) {
        if (number != null) {
            return 0;
        }
        return node.isBoolean() ? 1 : 2;
    }
}
