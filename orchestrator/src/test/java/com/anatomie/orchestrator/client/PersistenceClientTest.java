package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.TestProperties;
import com.anatomie.orchestrator.client.dto.GeneratedPrompt;
import com.anatomie.orchestrator.model.ScoreSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * PersistenceClient against a stub record API.
 */
class PersistenceClientTest {

    final ObjectMapper json = new ObjectMapper();

    StubServer    server;
    ServiceCaller caller;

    @BeforeEach
    void setUp() throws Exception {
        server = new StubServer();
        caller = new ServiceCaller(Duration.ofMillis(1), 2.0, new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    // ------------------------------------------------------------------
    // writeScores()
    // ------------------------------------------------------------------

    @Test
    void writeScores_noApiKey_skipsWithoutCalls() {
        PersistenceClient client = client("");

        PersistenceClient.WriteReport report = client.writeScores(scores("s1", 0.5));

        assertThat(report.skipped()).isTrue();
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void writeScores_onePatchPerEntityWithBearerToken() throws Exception {
        server.route("/tblStructures/", req -> StubServer.Response.json("{\"id\":\"x\",\"fields\":{}}"));
        PersistenceClient client = client("secret");

        PersistenceClient.WriteReport report = client.writeScores(
                new ScoreSet(Map.of("recA", 0.25, "recB", 0.75), Instant.EPOCH));

        assertThat(report).isEqualTo(new PersistenceClient.WriteReport(2, 0, false));
        assertThat(server.requests())
                .extracting(StubServer.Request::method, StubServer.Request::authorization)
                .containsOnly(tuple("PATCH", "Bearer secret"));
        assertThat(server.requests()).extracting(StubServer.Request::path)
                .containsExactlyInAnyOrder("/tblStructures/recA", "/tblStructures/recB");
        JsonNode body = json.readTree(server.requestsTo("/tblStructures/recA").get(0).body());
        assertThat(body.get("fields").get("optimizer_score").asDouble()).isEqualTo(0.25);
    }

    @Test
    void writeScores_oneEntityRejected_countedAsFailed() {
        server.route("/tblStructures/recA", req -> StubServer.Response.json("{}"));
        server.route("/tblStructures/recB", req -> new StubServer.Response(404, "{\"error\":\"NOT_FOUND\"}"));
        PersistenceClient client = client("secret");

        PersistenceClient.WriteReport report = client.writeScores(
                new ScoreSet(Map.of("recA", 0.25, "recB", 0.75), Instant.EPOCH));

        assertThat(report.written()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // writePrompts()
    // ------------------------------------------------------------------

    @Test
    void writePrompts_chunksOfTenThenHistoryRows() throws Exception {
        server.route("/Prompts", req -> StubServer.Response.json(echoCreated(req, "prompt")));
        server.route("/History", req -> StubServer.Response.json(echoCreated(req, "hist")));
        PersistenceClient client = client("secret");

        List<GeneratedPrompt> prompts = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            prompts.add(new GeneratedPrompt("prompt " + i, "ImageFX", "recDesigner", null, "recStruct"));
        }

        PersistenceClient.WriteReport report = client.writePrompts(prompts);

        assertThat(report).isEqualTo(new PersistenceClient.WriteReport(12, 0, false));
        assertThat(server.requestsTo("/Prompts")).hasSize(2);
        assertThat(server.requestsTo("/History")).hasSize(2);

        JsonNode first = json.readTree(server.requestsTo("/Prompts").get(0).body()).get("records").get(0);
        assertThat(first.get("fields").get("New Prompt").asText()).isEqualTo("prompt 0");
        assertThat(first.get("fields").get("Designer").get(0).asText()).isEqualTo("recDesigner");
        assertThat(first.get("fields").has("Garment")).isFalse();

        JsonNode history = json.readTree(server.requestsTo("/History").get(0).body()).get("records").get(0);
        assertThat(history.get("fields").get("Prompt ID").asText()).isEqualTo("prompt0");
        assertThat(history.get("fields").get("Prompt").asText()).isEqualTo("prompt 0");
    }

    @Test
    void writePrompts_promptsTableDown_reportsFailures() {
        server.route("/Prompts", req -> new StubServer.Response(403, "{\"error\":\"forbidden\"}"));
        PersistenceClient client = client("secret");

        PersistenceClient.WriteReport report = client.writePrompts(List.of(
                new GeneratedPrompt("a", "ImageFX", null, null, null),
                new GeneratedPrompt("b", "ImageFX", null, null, null)));

        assertThat(report.written()).isZero();
        assertThat(report.failed()).isEqualTo(2);
        assertThat(server.requestsTo("/History")).isEmpty();
    }

    @Test
    void writePrompts_badGatewayOnCreate_notRepeated() {
        server.route("/Prompts", req -> new StubServer.Response(502, "bad gateway"));
        PersistenceClient client = client("secret");

        PersistenceClient.WriteReport report = client.writePrompts(List.of(
                new GeneratedPrompt("a", "ImageFX", null, null, null)));

        assertThat(report.failed()).isEqualTo(1);
        assertThat(server.requestsTo("/Prompts")).hasSize(1);
    }

    @Test
    void writePrompts_rateLimitedOnCreate_retried() {
        AtomicInteger calls = new AtomicInteger();
        server.route("/Prompts", req -> calls.incrementAndGet() == 1
                ? new StubServer.Response(429, "{\"error\":\"RATE_LIMIT\"}")
                : StubServer.Response.json(echoCreated(req, "prompt")));
        server.route("/History", req -> StubServer.Response.json(echoCreated(req, "hist")));
        PersistenceClient client = client("secret");

        PersistenceClient.WriteReport report = client.writePrompts(List.of(
                new GeneratedPrompt("a", "ImageFX", null, null, null)));

        assertThat(report.written()).isEqualTo(1);
        assertThat(server.requestsTo("/Prompts")).hasSize(2);
    }

    // ------------------------------------------------------------------
    // readBatchSettings()
    // ------------------------------------------------------------------

    @Test
    void readBatchSettings_noApiKey_noneWithoutCalls() {
        PersistenceClient client = client("");

        assertThat(client.readBatchSettings()).isEqualTo(PersistenceClient.BatchSettings.none());
        assertThat(server.requests()).isEmpty();
    }

    @Test
    void readBatchSettings_firstRecordFieldsUsed() {
        server.route("/Daily Batch Settings", req -> StubServer.Response.json(
                "{\"records\":[{\"id\":\"recS\",\"fields\":"
                        + "{\"numPrompts\":12,\"renderer\":\"Midjourney\",\"batchEnabled\":true}}]}"));
        PersistenceClient client = client("secret");

        PersistenceClient.BatchSettings settings = client.readBatchSettings();

        assertThat(settings).isEqualTo(new PersistenceClient.BatchSettings(12, "Midjourney"));
        StubServer.Request req = server.requests().get(0);
        assertThat(req.method()).isEqualTo("GET");
        assertThat(req.authorization()).isEqualTo("Bearer secret");
    }

    @Test
    void readBatchSettings_noRecord_none() {
        server.route("/Daily Batch Settings", req -> StubServer.Response.json("{\"records\":[]}"));

        assertThat(client("secret").readBatchSettings()).isEqualTo(PersistenceClient.BatchSettings.none());
    }

    @Test
    void readBatchSettings_unusableValues_ignored() {
        server.route("/Daily Batch Settings", req -> StubServer.Response.json(
                "{\"records\":[{\"id\":\"recS\",\"fields\":{\"numPrompts\":0,\"renderer\":\" \"}}]}"));

        assertThat(client("secret").readBatchSettings()).isEqualTo(PersistenceClient.BatchSettings.none());
    }

    @Test
    void readBatchSettings_backendFails_noneInsteadOfThrowing() {
        server.route("/Daily Batch Settings", req -> new StubServer.Response(403, "{\"error\":\"forbidden\"}"));

        assertThat(client("secret").readBatchSettings()).isEqualTo(PersistenceClient.BatchSettings.none());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PersistenceClient client(String apiKey) {
        return new PersistenceClient(
                TestProperties.withPersistence(server.baseUrl(), apiKey),
                new JsonHttpTransport(json),
                caller);
    }

    private static ScoreSet scores(String id, double score) {
        return new ScoreSet(Map.of(id, score), Instant.EPOCH);
    }

    /** Returns the posted records with ids "<prefix><n>", like the real API. */
    private String echoCreated(StubServer.Request req, String idPrefix) {
        try {
            JsonNode records = json.readTree(req.body()).get("records");
            StringBuilder sb = new StringBuilder("{\"records\":[");
            for (int i = 0; i < records.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append("{\"id\":\"").append(idPrefix).append(i).append("\",\"fields\":")
                  .append(json.writeValueAsString(records.get(i).get("fields"))).append('}');
            }
            return sb.append("]}").toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
