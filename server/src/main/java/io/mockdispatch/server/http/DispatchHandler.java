package io.mockdispatch.server.http;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.mockdispatch.core.dispatch.RequestDispatcher;
import io.mockdispatch.core.model.MockRequest;
import io.mockdispatch.core.model.MockResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves every method and path under the base path from the {@link RequestDispatcher}.
 *
 * <p>
 * Rejects bodies larger than the configured limit with 413 before reading them into a
 * {@link MockRequest}. Thread-safe; all state is local to each call.
 */
public final class DispatchHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchHandler.class);

    private final RequestDispatcher dispatcher;
    private final String basePath;
    private final int maxBodyBytes;

    /**
     * @param basePath     mount prefix stripped before dispatch
     * @param maxBodyBytes largest accepted request body
     */
    public DispatchHandler(RequestDispatcher dispatcher, String basePath, int maxBodyBytes) {
        this.dispatcher = dispatcher;
        this.basePath = basePath;
        this.maxBodyBytes = maxBodyBytes;
    }

    @Override
    public void handle(Context ctx) throws Exception {
        long contentLength = ctx.contentLength();
        if (contentLength > maxBodyBytes) {
            LOG.warn("Request body too large: {} bytes (limit {})", contentLength, maxBodyBytes);
            JsonResponses.error(ctx, 413, "Request body exceeds " + maxBodyBytes + " bytes");
            return;
        }
        MockRequest request = JavalinRequests.toMockRequest(ctx, basePath);
        MockResponse response = dispatcher.dispatch(request);
        JsonResponses.write(ctx, response);
    }
}
