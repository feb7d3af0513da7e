package io.mockdispatch.core.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Query string of a collection GET, split into filter clauses and reserved directives.
 *
 * <p>
 * Reserved keys are {@code _page, _limit, _sort, _order, _embed, _expand, _search}; every other
 * key is a filter. When a key repeats, its last value wins.
 *
 * @param filters filter clauses in query order, combined with AND
 * @param search  full-text term, or null
 * @param sort    sort keys in priority order
 * @param page    1-based page number
 * @param limit   page size
 * @param embed   child collections to embed
 * @param expand  parent collections to expand
 */
public record QueryDirectives(
        List<FieldFilter> filters,
        String search,
        List<SortKey> sort,
        int page,
        int limit,
        List<String> embed,
        List<String> expand) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;

    static final Set<String> RESERVED = Set.of("_page", "_limit", "_sort", "_order", "_embed", "_expand", "_search");

    public QueryDirectives {
        filters = List.copyOf(filters);
        sort = List.copyOf(sort);
        embed = List.copyOf(embed);
        expand = List.copyOf(expand);
    }

    /**
     * One sort key.
     *
     * @param field      record field
     * @param descending {@code true} only for an explicit {@code desc}
     */
    public record SortKey(String field, boolean descending) {}

    /** Parses with the built-in default page size. */
    public static QueryDirectives parse(Map<String, List<String>> query) {
        return parse(query, DEFAULT_LIMIT);
    }

    /**
     * Parses a multi-valued query map. Malformed paging values fall back to the defaults.
     *
     * @param defaultLimit page size used when {@code _limit} is absent or invalid
     */
    public static QueryDirectives parse(Map<String, List<String>> query, int defaultLimit) {
        Objects.requireNonNull(query, "query must not be null");
        List<FieldFilter> filters = new ArrayList<>();
        query.forEach((key, values) -> {
            String value = last(values);
            if (value != null && !RESERVED.contains(key)) {
                filters.add(FieldFilter.parse(key, value));
            }
        });

        String search = last(query.get("_search"));
        if (search != null && search.isEmpty()) {
            search = null;
        }

        return new QueryDirectives(
                filters,
                search,
                sortKeys(last(query.get("_sort")), last(query.get("_order"))),
                positiveOr(last(query.get("_page")), DEFAULT_PAGE),
                positiveOr(last(query.get("_limit")), defaultLimit),
                names(last(query.get("_embed"))),
                names(last(query.get("_expand"))));
    }

    private static List<SortKey> sortKeys(String sort, String order) {
        List<String> fields = names(sort);
        if (fields.isEmpty()) {
            return List.of();
        }
        String[] orders = order == null ? new String[0] : order.split(",");
        List<SortKey> keys = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            boolean desc = i < orders.length && "desc".equals(orders[i].trim());
            keys.add(new SortKey(fields.get(i), desc));
        }
        return keys;
    }

    private static List<String> names(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static int positiveOr(String raw, int fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static String last(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }
}
