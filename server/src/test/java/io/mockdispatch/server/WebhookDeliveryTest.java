package io.mockdispatch.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WebhookDeliveryTest extends MockServerTestHarness {

    @TempDir
    Path dir;

    private HttpServer receiver;
    private final BlockingQueue<String> deliveries = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() throws Exception {
        receiver = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        receiver.createContext("/hooks", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                deliveries.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        receiver.start();

        String hook = "http://127.0.0.1:" + receiver.getAddress().getPort() + "/hooks";
        startWith(
                dir,
                "apis:\n"
                        + "  - id: create-order\n"
                        + "    method: POST\n"
                        + "    path: /orders\n"
                        + "    statusCode: 201\n"
                        + "    webhookUrl: " + hook + "\n"
                        + "    responseBody: {accepted: true}\n"
                        + "  - id: dead-hook\n"
                        + "    method: GET\n"
                        + "    path: /dead\n"
                        + "    webhookUrl: http://127.0.0.1:1/nowhere\n"
                        + "    responseBody: {ok: true}\n",
                UnaryOperator.identity());
    }

    @AfterEach
    void tearDown() {
        stopServer();
        receiver.stop(0);
    }

    @Test
    void invocationIsReportedToWebhook() throws Exception {
        HttpResponse<String> response = send("POST", "/v1/orders", "{\"sku\":\"A-1\"}");

        assertThat(response.statusCode()).isEqualTo(201);
        String delivery = deliveries.poll(5, TimeUnit.SECONDS);
        assertThat(delivery).isNotNull();
        JsonNode payload = MAPPER.readTree(delivery);
        assertThat(payload.get("method").asText()).isEqualTo("POST");
        assertThat(payload.get("path").asText()).isEqualTo("/orders");
        assertThat(payload.get("body").get("sku").asText()).isEqualTo("A-1");
    }

    @Test
    void unreachableWebhookDoesNotAffectResponse() throws Exception {
        HttpResponse<String> response = get("/v1/dead");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("ok").asBoolean()).isTrue();
    }
}
