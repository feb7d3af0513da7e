package io.mockdispatch.core.routing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A custom API path: either a literal ({@code /health/check}) or a template with
 * colon-prefixed parameters ({@code /users/:id/posts/:postId}).
 *
 * <p>
 * A parameter binds exactly one non-empty segment and never spans segments; literal segments
 * must be equal. Empty segments (leading, trailing or doubled slashes) are ignored on both
 * sides.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class PathTemplate {

    private final String source;
    private final List<String> segments;

    private PathTemplate(String source, List<String> segments) {
        this.source = source;
        this.segments = segments;
    }

    /** Compiles a path template. */
    public static PathTemplate compile(String template) {
        return new PathTemplate(template, List.copyOf(split(template)));
    }

    /**
     * Matches a request path against this template.
     *
     * @param path request path, e.g. {@code /users/42}
     * @return URL-decoded parameter bindings, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        List<String> parts = split(path);
        if (parts.size() != segments.size()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < segments.size(); i++) {
            String pattern = segments.get(i);
            String actual = parts.get(i);
            if (isParameter(pattern)) {
                params.put(pattern.substring(1), decode(actual));
            } else if (!pattern.equals(actual)) {
                return Optional.empty();
            }
        }
        return Optional.of(Collections.unmodifiableMap(params));
    }

    /** Whether the template contains at least one parameter segment. */
    public boolean isParameterized() {
        return segments.stream().anyMatch(PathTemplate::isParameter);
    }

    public String source() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

    /** Splits a path into its non-empty segments. */
    static List<String> split(String path) {
        List<String> parts = new ArrayList<>();
        if (path == null) {
            return parts;
        }
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts;
    }

    private static boolean isParameter(String segment) {
        return segment.length() > 1 && segment.charAt(0) == ':';
    }

    private static String decode(String segment) {
        try {
            return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return segment;
        }
    }
}
