package io.mockdispatch.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MockServerIntegrationTest extends MockServerTestHarness {

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws Exception {
        startWithFixture(dir);
    }

    @AfterEach
    void tearDown() {
        stopServer();
    }

    @Test
    void healthEndpoint() throws Exception {
        HttpResponse<String> response = get("/health");

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(json(response).get("status").asText()).isEqualTo("UP");
        assertThat(json(response).get("apis").asInt()).isEqualTo(4);
        assertThat(json(response).get("resources").asInt()).isEqualTo(2);
    }

    @Test
    void requestIdIsGeneratedOrEchoed() throws Exception {
        HttpResponse<String> generated = get("/v1/status");
        HttpResponse<String> echoed = client.send(
                HttpRequest.newBuilder(uri("/v1/status")).header("X-Request-ID", "abc-123").build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(generated.headers().firstValue(MockServerApp.REQUEST_ID_HEADER)).isPresent();
        assertThat(echoed.headers().firstValue(MockServerApp.REQUEST_ID_HEADER)).hasValue("abc-123");
    }

    @Test
    void customApiResponses() throws Exception {
        HttpResponse<String> status = get("/v1/status");
        HttpResponse<String> profile = get("/v1/users/7/profile");
        HttpResponse<String> ping = send("DELETE", "/v1/ping", null);

        assertThat(status.statusCode()).isEqualTo(200);
        assertThat(status.headers().firstValue("Content-Type")).hasValueSatisfying(v -> assertThat(v).contains("application/json"));
        assertThat(json(status).get("status").asText()).isEqualTo("ok");
        assertThat(json(profile).get("plan").asText()).isEqualTo("pro");
        assertThat(ping.statusCode()).isEqualTo(204);
        assertThat(ping.body()).isEmpty();
    }

    @Test
    void conditionalResponseFollowsHeader() throws Exception {
        HttpResponse<String> premium = client.send(
                HttpRequest.newBuilder(uri("/v1/premium")).header("X-Plan", "premium").build(),
                HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> basic = get("/v1/premium");

        assertThat(premium.statusCode()).isEqualTo(200);
        assertThat(json(premium).get("access").asText()).isEqualTo("granted");
        assertThat(basic.statusCode()).isEqualTo(403);
        assertThat(json(basic).get("access").asText()).isEqualTo("denied");
    }

    @Test
    @DisplayName("Seeded resources are served with pagination")
    void seededResourcePagination() throws Exception {
        HttpResponse<String> response = get("/v1/users?_limit=5&_page=3");

        JsonNode body = json(response);
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(body.get("data")).hasSize(2);
        assertThat(body.get("pagination").get("total").asInt()).isEqualTo(12);
        assertThat(body.get("pagination").get("totalPages").asInt()).isEqualTo(3);
    }

    @Test
    void crudRoundTrip() throws Exception {
        assertThat(get("/v1/notes").statusCode()).isEqualTo(404);

        HttpResponse<String> created = send("POST", "/v1/notes", "{\"text\":\"hello\"}");
        assertThat(created.statusCode()).isEqualTo(201);
        String id = json(created).get("id").asText();

        HttpResponse<String> list = get("/v1/notes");
        assertThat(json(list).get("data")).hasSize(1);

        HttpResponse<String> updated = send("PUT", "/v1/notes/" + id, "{\"text\":\"bye\"}");
        assertThat(json(updated).get("text").asText()).isEqualTo("bye");
        assertThat(json(updated).get("id").asText()).isEqualTo(id);

        assertThat(json(get("/v1/notes/" + id)).get("text").asText()).isEqualTo("bye");

        HttpResponse<String> deleted = send("DELETE", "/v1/notes/" + id, null);
        assertThat(json(deleted).get("success").asBoolean()).isTrue();

        HttpResponse<String> gone = get("/v1/notes/" + id);
        assertThat(gone.statusCode()).isEqualTo(404);
        assertThat(json(gone).get("error").asText()).isEqualTo("Item not found");
    }

    @Test
    void nonObjectBodyIsRejected() throws Exception {
        HttpResponse<String> response = send("POST", "/v1/notes", "[1,2]");

        assertThat(response.statusCode()).isEqualTo(400);
        assertThat(json(response).get("error").asText()).isEqualTo("Request body must be a JSON object");
    }

    @Test
    void unknownPathListsAvailableDefinitions() throws Exception {
        HttpResponse<String> response = get("/v1/unknown");

        JsonNode body = json(response);
        assertThat(response.statusCode()).isEqualTo(404);
        assertThat(body.get("error").asText()).isEqualTo("Mock API not found for GET /unknown");
        assertThat(body.get("hint").asText()).isEqualTo("Available resources: users, notes");
        assertThat(body.get("availableApis")).hasSize(4);
    }

    @Test
    void unsupportedMethodIs405() throws Exception {
        HttpResponse<String> response = send("TRACE", "/v1/status", null);

        assertThat(response.statusCode()).isEqualTo(405);
    }

    @Test
    void oversizedBodyIs413() throws Exception {
        stopServer();
        startWith(dir, "resources: [{id: r, name: notes}]", builder -> builder.maxBodyBytes(64));

        HttpResponse<String> response = send("POST", "/v1/notes", "{\"text\":\"" + "x".repeat(200) + "\"}");

        assertThat(response.statusCode()).isEqualTo(413);
    }
}
