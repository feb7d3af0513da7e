package io.mockdispatch.server.http;

import io.javalin.http.Context;
import io.mockdispatch.core.model.MockRequest;
import java.util.LinkedHashMap;
import java.util.Map;

/** Converts Javalin requests into {@link MockRequest}s. Stateless utility class. */
final class JavalinRequests {

    private JavalinRequests() {}

    /**
     * Builds the transport-neutral request, stripping the mount prefix from the path.
     *
     * @param basePath mount prefix, e.g. {@code /v1}
     */
    static MockRequest toMockRequest(Context ctx, String basePath) {
        String fullPath = ctx.path();
        String path = fullPath.startsWith(basePath) ? fullPath.substring(basePath.length()) : fullPath;
        if (path.isEmpty()) {
            path = "/";
        }
        Map<String, String> headers = new LinkedHashMap<>(ctx.headerMap());
        return new MockRequest(ctx.method().name(), path, ctx.queryParamMap(), headers, ctx.body());
    }
}
