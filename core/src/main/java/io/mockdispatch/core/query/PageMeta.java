package io.mockdispatch.core.query;

/**
 * Pagination block of a collection response.
 *
 * @param page       requested page (1-based)
 * @param limit      page size
 * @param total      record count after filtering and search
 * @param totalPages {@code ceil(total / limit)}
 */
public record PageMeta(int page, int limit, int total, int totalPages) {

    static PageMeta of(int page, int limit, int total) {
        return new PageMeta(page, limit, total, (int) ((total + (long) limit - 1) / limit));
    }
}
