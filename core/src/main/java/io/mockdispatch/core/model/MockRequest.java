package io.mockdispatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral view of an inbound request on the dynamic endpoint surface.
 *
 * <p>
 * Header names are normalized to lower case. Query parameters keep every value in arrival
 * order; {@link #queryParam(String)} returns the last one.
 *
 * @param method      upper-case HTTP method
 * @param path        path relative to the mount prefix, e.g. {@code /users/42}
 * @param queryParams query parameters, multi-valued
 * @param headers     request headers with lower-case names
 * @param body        raw request body, may be null or empty
 */
public record MockRequest(
        String method, String path, Map<String, List<String>> queryParams, Map<String, String> headers, String body) {

    public MockRequest {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(path, "path must not be null");
        method = method.toUpperCase(Locale.ROOT);
        queryParams = queryParams == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        headers = headers == null ? Map.of() : lowerCaseKeys(headers);
    }

    /** Request with no query, headers or body. */
    public static MockRequest of(String method, String path) {
        return new MockRequest(method, path, Map.of(), Map.of(), null);
    }

    /** Last value of a query parameter, or null. */
    public String queryParam(String key) {
        List<String> values = queryParams.get(key);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    /** Header value by case-insensitive name, or null. */
    public String header(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> headers) {
        Map<String, String> normalized = new LinkedHashMap<>();
        headers.forEach((name, value) -> normalized.putIfAbsent(name.toLowerCase(Locale.ROOT), value));
        return Collections.unmodifiableMap(normalized);
    }
}
