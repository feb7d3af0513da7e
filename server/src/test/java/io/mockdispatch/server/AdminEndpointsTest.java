package io.mockdispatch.server;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AdminEndpointsTest extends MockServerTestHarness {

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

    @Nested
    @DisplayName("POST /admin/reload")
    class Reload {

        @Test
        void reloadPicksUpNewDefinitions() throws Exception {
            Files.writeString(
                    definitionsFile,
                    "apis: [{id: fresh, method: GET, path: /fresh, responseBody: {v: 2}}]\n"
                            + "resources: [{id: r, name: notes}]");

            HttpResponse<String> response = send("POST", "/admin/reload", null);

            JsonNode body = json(response);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("status").asText()).isEqualTo("reloaded");
            assertThat(body.get("apis").asInt()).isEqualTo(1);
            assertThat(body.get("resources").asInt()).isEqualTo(1);
            assertThat(json(get("/v1/fresh")).get("v").asInt()).isEqualTo(2);
            assertThat(get("/v1/status").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("A broken file answers 500 and the previous definitions keep serving")
        void brokenReloadKeepsPreviousDefinitions() throws Exception {
            Files.writeString(definitionsFile, "apis: [{id: broken, path: /x}]");

            HttpResponse<String> response = send("POST", "/admin/reload", null);

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(json(response).get("error").asText()).startsWith("Reload failed:");
            assertThat(get("/v1/status").statusCode()).isEqualTo(200);
        }
    }

    @Nested
    @DisplayName("Record administration")
    class Records {

        @Test
        void generateReplacesCollection() throws Exception {
            HttpResponse<String> response = send("POST", "/admin/resources/notes/generate", "{\"count\":3}");

            JsonNode body = json(response);
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(body.get("success").asBoolean()).isTrue();
            assertThat(body.get("count").asInt()).isEqualTo(3);
            assertThat(body.get("data")).hasSize(3);
            assertThat(json(get("/v1/notes")).get("pagination").get("total").asInt()).isEqualTo(3);
        }

        @Test
        void generateDefaultsToTenRecords() throws Exception {
            HttpResponse<String> response = send("POST", "/admin/resources/notes/generate", null);

            assertThat(json(response).get("count").asInt()).isEqualTo(10);
        }

        @Test
        void generateRejectsBadCount() throws Exception {
            assertThat(send("POST", "/admin/resources/notes/generate", "{\"count\":0}").statusCode())
                    .isEqualTo(400);
            assertThat(send("POST", "/admin/resources/notes/generate", "{\"count\":1001}").statusCode())
                    .isEqualTo(400);
            assertThat(send("POST", "/admin/resources/notes/generate", "{\"count\":\"many\"}").statusCode())
                    .isEqualTo(400);
        }

        @Test
        @DisplayName("Counts beyond the int range are rejected, not wrapped")
        void generateRejectsCountOutsideIntRange() throws Exception {
            HttpResponse<String> number = send("POST", "/admin/resources/notes/generate", "{\"count\":4294967297}");
            HttpResponse<String> text = send("POST", "/admin/resources/notes/generate", "{\"count\":\"4294967297\"}");

            assertThat(number.statusCode()).isEqualTo(400);
            assertThat(json(number).get("error").asText()).startsWith("count must be an integer");
            assertThat(text.statusCode()).isEqualTo(400);
        }

        @Test
        void unknownResourceIs404() throws Exception {
            HttpResponse<String> generate = send("POST", "/admin/resources/ghosts/generate", "{}");
            HttpResponse<String> clear = send("DELETE", "/admin/resources/ghosts/records", null);

            assertThat(generate.statusCode()).isEqualTo(404);
            assertThat(json(generate).get("error").asText()).isEqualTo("Resource not found");
            assertThat(clear.statusCode()).isEqualTo(404);
        }

        @Test
        void clearDropsCollection() throws Exception {
            HttpResponse<String> response = send("DELETE", "/admin/resources/users/records", null);

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("success").asBoolean()).isTrue();
            assertThat(get("/v1/users").statusCode()).isEqualTo(404);
            assertThat(server.store().exists("users")).isFalse();
        }
    }
}
