package io.mockdispatch.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import io.mockdispatch.core.json.JsonNodeUtils;

/**
 * Comparable view of one side of an operator filter ({@code age_gte=18}).
 *
 * <p>
 * Query values and record fields are both lifted into this union before comparison, so the
 * comparison rules live in one place: numbers compare numerically, everything else by its text
 * form, and {@link Absent} never satisfies an ordering operator. A number never satisfies an
 * ordering operator against non-numeric text.
 */
sealed interface FilterValue {

    /** A numeric value, from a JSON number or a numeric string. */
    record Num(double value) implements FilterValue {}

    /** A non-numeric value, compared by its text form. */
    record Text(String value) implements FilterValue {}

    /** A JSON boolean. */
    record Bool(boolean value) implements FilterValue {}

    /** A missing or null field. */
    record Absent() implements FilterValue {}

    Absent ABSENT = new Absent();

    /** Lifts a raw query string value. Numeric text becomes {@link Num}. */
    static FilterValue ofQuery(String raw) {
        if (raw == null) {
            return ABSENT;
        }
        Double number = JsonNodeUtils.parseNumber(raw);
        return number != null ? new Num(number) : new Text(raw);
    }

    /** Lifts a record field. */
    static FilterValue ofField(JsonNode node) {
        if (!JsonNodeUtils.isPresent(node)) {
            return ABSENT;
        }
        if (node.isBoolean()) {
            return new Bool(node.booleanValue());
        }
        Double number = JsonNodeUtils.asNumber(node);
        if (number != null) {
            return new Num(number);
        }
        return new Text(JsonNodeUtils.textForm(node));
    }

    /** Text form used when the two sides are not both numeric. */
    default String text() {
        if (this instanceof Num n) {
            double v = n.value();
            if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
                return Long.toString((long) v);
            }
            return Double.toString(v);
        }
        if (this instanceof Text t) {
            return t.value();
        }
        if (this instanceof Bool b) {
            return Boolean.toString(b.value());
        }
        return null;
    }

    /**
     * Three-way comparison, numeric when both sides are {@link Num}, otherwise by text form.
     * Callers must rule out {@link Absent} first.
     */
    static int compare(FilterValue left, FilterValue right) {
        if (left instanceof Num l && right instanceof Num r) {
            return Double.compare(l.value(), r.value());
        }
        return left.text().compareTo(right.text());
    }

    /** Loose equality: numeric when both sides are numbers, otherwise text forms. */
    static boolean looseEquals(FilterValue left, FilterValue right) {
        if (left instanceof Absent || right instanceof Absent) {
            return false;
        }
        return compare(left, right) == 0;
    }
}
