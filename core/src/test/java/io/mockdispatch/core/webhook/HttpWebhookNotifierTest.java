package io.mockdispatch.core.webhook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWebhookNotifierTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer receiver;
    private final BlockingQueue<String> received = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> contentTypes = new LinkedBlockingQueue<>();
    private HttpWebhookNotifier notifier;

    @BeforeEach
    void setUp() throws IOException {
        receiver = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        receiver.createContext("/hook", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                received.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            contentTypes.add(String.valueOf(exchange.getRequestHeaders().getFirst("Content-Type")));
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        receiver.createContext("/fail", exchange -> {
            exchange.getRequestBody().readAllBytes();
            received.add("fail");
            exchange.sendResponseHeaders(500, -1);
            exchange.close();
        });
        receiver.start();
        notifier = new HttpWebhookNotifier(MAPPER, Duration.ofSeconds(2), 2, 16);
    }

    @AfterEach
    void tearDown() {
        notifier.close();
        receiver.stop(0);
    }

    private String url(String path) {
        return "http://127.0.0.1:" + receiver.getAddress().getPort() + path;
    }

    @Test
    void postsPayloadAsJson() throws Exception {
        notifier.notify(url("/hook"), new WebhookPayload("POST", "/orders", MAPPER.readTree("{\"amount\":5}")));

        String body = received.poll(5, TimeUnit.SECONDS);
        assertThat(body).isNotNull();
        JsonNode json = MAPPER.readTree(body);
        assertThat(json.get("method").asText()).isEqualTo("POST");
        assertThat(json.get("path").asText()).isEqualTo("/orders");
        assertThat(json.get("body").get("amount").asInt()).isEqualTo(5);
        assertThat(contentTypes.poll(5, TimeUnit.SECONDS)).isEqualTo("application/json");
    }

    @Test
    void getPayloadCarriesNullBody() throws Exception {
        notifier.notify(url("/hook"), new WebhookPayload("GET", "/status", MAPPER.readTree("{\"x\":1}")));

        JsonNode json = MAPPER.readTree(received.poll(5, TimeUnit.SECONDS));
        assertThat(json.get("body")).isEqualTo(NullNode.getInstance());
    }

    @Test
    void errorStatusIsNotPropagated() throws Exception {
        assertThatCode(() -> notifier.notify(url("/fail"), new WebhookPayload("GET", "/x", null)))
                .doesNotThrowAnyException();

        assertThat(received.poll(5, TimeUnit.SECONDS)).isEqualTo("fail");
    }

    @Test
    void invalidOrUnreachableUrlsAreSwallowed() {
        assertThatCode(() -> {
                    notifier.notify("not a url", new WebhookPayload("GET", "/x", null));
                    notifier.notify("ftp://127.0.0.1/x", new WebhookPayload("GET", "/x", null));
                    notifier.notify("http://127.0.0.1:1/unreachable", new WebhookPayload("GET", "/x", null));
                })
                .doesNotThrowAnyException();
    }

    @Test
    void notifyAfterCloseIsDropped() {
        notifier.close();

        assertThatCode(() -> notifier.notify(url("/hook"), new WebhookPayload("GET", "/x", null)))
                .doesNotThrowAnyException();
    }
}
