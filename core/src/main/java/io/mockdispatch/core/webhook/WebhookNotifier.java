package io.mockdispatch.core.webhook;

/**
 * Fire-and-forget outbound notification.
 *
 * <p>
 * {@link #notify(String, WebhookPayload)} must return without waiting for delivery and must
 * never throw for delivery problems. Delivery is best effort: no retries, no ordering.
 */
public interface WebhookNotifier extends AutoCloseable {

    /** Schedules a POST of {@code payload} to {@code url}. */
    void notify(String url, WebhookPayload payload);

    /** Stops accepting notifications and releases delivery threads. */
    @Override
    void close();
}
