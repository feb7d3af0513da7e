package io.mockdispatch.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;

/**
 * Shared JSON node helpers for the query engine and the conditional evaluator.
 *
 * <p>
 * Thread-safe, stateless utility class.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /** {@code true} when the node is neither absent, JSON null nor missing. */
    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    /**
     * Text form of a value as it appears in a query string: strings as-is, integral numbers
     * without a fraction ({@code 30.0} becomes {@code "30"}), booleans as {@code true/false},
     * containers as compact JSON. Absent values yield {@code null}.
     */
    public static String textForm(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isNumber()) {
            return numberText(node);
        }
        if (node.isBoolean()) {
            return Boolean.toString(node.booleanValue());
        }
        return node.toString();
    }

    /**
     * Numeric value of a node: numbers directly, strings when the whole trimmed text parses as a
     * finite number. Returns {@code null} otherwise.
     */
    public static Double asNumber(JsonNode node) {
        if (!isPresent(node)) {
            return null;
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            return parseNumber(node.textValue());
        }
        return null;
    }

    /** Parses a finite decimal number, or returns {@code null}. */
    public static Double parseNumber(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            double value = new BigDecimal(trimmed).doubleValue();
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Loose equality between two JSON values: numerically when both sides are numeric (numeric
     * strings included), otherwise by text form. Absent values are never equal to anything.
     */
    public static boolean looseEquals(JsonNode left, JsonNode right) {
        if (!isPresent(left) || !isPresent(right)) {
            return false;
        }
        Double l = asNumber(left);
        Double r = asNumber(right);
        if (l != null && r != null) {
            return Double.compare(l, r) == 0;
        }
        return textForm(left).equals(textForm(right));
    }

    /**
     * Resolves a dot-separated path ({@code a.b.0.c}) against a JSON tree. Numeric segments
     * index arrays. An empty or null path returns the root. Unresolvable paths return
     * {@link MissingNode}.
     */
    public static JsonNode atPath(JsonNode root, String dotPath) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        if (dotPath == null || dotPath.isBlank()) {
            return root;
        }
        JsonNode current = root;
        for (String segment : dotPath.split("\\.")) {
            if (current.isArray()) {
                current = current.path(parseIndex(segment));
            } else if (current.isObject()) {
                current = current.path(segment);
            } else {
                return MissingNode.getInstance();
            }
            if (current.isMissingNode()) {
                return current;
            }
        }
        return current;
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private static String numberText(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.asText();
        }
        BigDecimal decimal = node.decimalValue().stripTrailingZeros();
        if (decimal.scale() <= 0) {
            return decimal.toBigInteger().toString();
        }
        return decimal.toPlainString();
    }
}
