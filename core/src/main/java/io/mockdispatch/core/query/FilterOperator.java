package io.mockdispatch.core.query;

import java.util.Locale;

/** Suffix operators accepted on filter keys, e.g. {@code price_lt=50}. */
public enum FilterOperator {
    GTE,
    LTE,
    GT,
    LT,
    NE;

    /** The key suffix including the separator, e.g. {@code "_gte"}. */
    String suffix() {
        return "_" + name().toLowerCase(Locale.ROOT);
    }

    boolean test(FilterValue field, FilterValue filter) {
        if (this == NE) {
            return !FilterValue.looseEquals(field, filter);
        }
        if (field instanceof FilterValue.Absent || filter instanceof FilterValue.Absent) {
            return false;
        }
        if ((field instanceof FilterValue.Num) != (filter instanceof FilterValue.Num)) {
            return false;
        }
        int cmp = FilterValue.compare(field, filter);
        return switch (this) {
            case GTE -> cmp >= 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case LT -> cmp < 0;
            case NE -> throw new IllegalStateException("unreachable");
        };
    }
}
