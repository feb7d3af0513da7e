package io.mockdispatch.core.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link WebhookNotifier} that POSTs JSON with the JDK {@link HttpClient} from a small bounded
 * pool of daemon threads.
 *
 * <p>
 * Every failure (malformed URL, connection error, timeout, non-2xx status, full queue) is
 * logged at WARN and dropped. Thread-safe.
 */
public final class HttpWebhookNotifier implements WebhookNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(HttpWebhookNotifier.class);

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Duration timeout;
    private final ThreadPoolExecutor executor;

    /**
     * @param timeout       connect and request timeout per delivery
     * @param threads       delivery threads
     * @param queueCapacity pending deliveries held before new ones are dropped
     */
    public HttpWebhookNotifier(ObjectMapper mapper, Duration timeout, int threads, int queueCapacity) {
        this.mapper = mapper;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                60,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                daemonThreads(),
                new ThreadPoolExecutor.AbortPolicy());
        LOG.debug("Webhook notifier started: threads={}, queue={}, timeout={}", threads, queueCapacity, timeout);
    }

    @Override
    public void notify(String url, WebhookPayload payload) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload.toJson())))
                    .build();
        } catch (IllegalArgumentException | JsonProcessingException e) {
            LOG.warn("Webhook to '{}' skipped: {}", url, e.getMessage());
            return;
        }
        try {
            executor.execute(() -> deliver(request));
        } catch (RejectedExecutionException e) {
            LOG.warn("Webhook to {} dropped: delivery queue full or notifier closed", url);
        }
    }

    private void deliver(HttpRequest request) {
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                LOG.warn("Webhook to {} answered {}", request.uri(), status);
            } else {
                LOG.debug("Webhook delivered to {} ({})", request.uri(), status);
            }
        } catch (IOException e) {
            LOG.warn("Webhook to {} failed: {}", request.uri(), e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Webhook to {} interrupted", request.uri());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "webhook-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
