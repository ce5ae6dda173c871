package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.TestProperties;
import com.anatomie.orchestrator.client.dto.GeneratedPrompt;
import com.anatomie.orchestrator.client.dto.UpdatePreferencesRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GeneratorClient against a stub generator: chunking, payload shape, and
 * which failures a prompt request may be repeated after.
 */
class GeneratorClientTest {

    final ObjectMapper json = new ObjectMapper();

    StubServer        server;
    JsonHttpTransport http;
    ServiceCaller     caller;
    GeneratorClient   client;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer();
        http   = new JsonHttpTransport(json);
        caller = new ServiceCaller(Duration.ofMillis(1), 2.0, new SimpleMeterRegistry());
        client = new GeneratorClient(TestProperties.withServiceUrl(server.baseUrl()), http, caller);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ------------------------------------------------------------------
    // generatePrompts()
    // ------------------------------------------------------------------

    @Test
    void generatePrompts_25_requestedInChunksOf10_10_5() {
        server.route("/generate-prompts", req -> StubServer.Response.json(promptsFor(req)));

        List<GeneratedPrompt> prompts = client.generatePrompts(25, "ImageFX");

        assertThat(prompts).hasSize(25);
        assertThat(server.requestsTo("/generate-prompts"))
                .extracting(req -> numPrompts(req.body()))
                .containsExactly(10, 10, 5);
        assertThat(prompts.get(0).renderer()).isEqualTo("ImageFX");
    }

    @Test
    void generatePrompts_serviceUnavailable_chunkRetried() {
        AtomicInteger calls = new AtomicInteger();
        server.route("/generate-prompts", req -> calls.incrementAndGet() == 1
                ? new StubServer.Response(503, "waking up")
                : StubServer.Response.json(promptsFor(req)));

        List<GeneratedPrompt> prompts = client.generatePrompts(4, "Midjourney");

        assertThat(prompts).hasSize(4);
        assertThat(calls).hasValue(2);
    }

    @Test
    void generatePrompts_badGateway_notRepeated() {
        server.route("/generate-prompts", req -> new StubServer.Response(502, "bad gateway"));

        assertThatThrownBy(() -> client.generatePrompts(4, "Midjourney"))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("502");
        assertThat(server.requestsTo("/generate-prompts")).hasSize(1);
    }

    @Test
    void generatePrompts_answerArrivesAfterTimeout_notRepeated() {
        server.route("/generate-prompts", req -> StubServer.Response.slow(Duration.ofSeconds(2), promptsFor(req)));
        GeneratorClient impatient = new GeneratorClient(
                TestProperties.withServiceUrl(server.baseUrl(), Duration.ofMillis(200)), http, caller);

        assertThatThrownBy(() -> impatient.generatePrompts(4, "Midjourney"))
                .isInstanceOf(ServiceException.class)
                .extracting(e -> ((ServiceException) e).getKind())
                .isEqualTo(ServiceException.Kind.TRANSIENT);
        assertThat(server.requestsTo("/generate-prompts")).hasSize(1);
    }

    @Test
    void generatePrompts_collaboratorError_propagates() {
        server.route("/generate-prompts", req -> new StubServer.Response(422, "{\"detail\":\"bad renderer\"}"));

        assertThatThrownBy(() -> client.generatePrompts(5, "Nope"))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("422");
        assertThat(server.requestsTo("/generate-prompts")).hasSize(1);
    }

    // ------------------------------------------------------------------
    // updatePreferences() / warmUp()
    // ------------------------------------------------------------------

    @Test
    void updatePreferences_sendsSnakeCasePayload() throws Exception {
        server.route("/update_preferences", req -> StubServer.Response.json("{\"status\":\"ok\"}"));

        client.updatePreferences(new UpdatePreferencesRequest(
                Map.of("minimal", 0.4), 0.2, Map.of("s1", 0.9), Map.of("s1", Map.of("tip", "short"))));

        JsonNode body = json.readTree(server.requestsTo("/update_preferences").get(0).body());
        assertThat(body.get("exploration_rate").asDouble()).isEqualTo(0.2);
        assertThat(body.get("structure_scores").get("s1").asDouble()).isEqualTo(0.9);
        assertThat(body.has("global_preference_vector")).isTrue();
        assertThat(body.has("structure_prompt_insights")).isTrue();
    }

    @Test
    void warmUp_unhealthy_returnsFalseWithoutThrowing() {
        server.route("/health", req -> new StubServer.Response(503, ""));

        assertThat(client.warmUp()).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private int numPrompts(String body) {
        try {
            return json.readTree(body).get("num_prompts").asInt();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private String promptsFor(StubServer.Request req) {
        try {
            JsonNode body = json.readTree(req.body());
            int n = body.get("num_prompts").asInt();
            String renderer = body.get("renderer").asText();
            StringBuilder sb = new StringBuilder("{\"prompts\":[");
            for (int i = 0; i < n; i++) {
                if (i > 0) sb.append(',');
                sb.append("{\"promptText\":\"prompt ").append(i)
                  .append("\",\"renderer\":\"").append(renderer).append("\"}");
            }
            return sb.append("]}").toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
