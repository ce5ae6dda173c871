package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.client.dto.GeneratedPrompt;
import com.anatomie.orchestrator.client.dto.PersistenceRecords;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import com.anatomie.orchestrator.model.ScoreSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HTTP client for the persistence backend (Airtable-style record API).
 *
 * Writes are skipped entirely when no API key is configured, so local runs
 * work without credentials. Individual write failures are counted, not
 * thrown: callers decide what a partial write means for them.
 */
@Component
public class PersistenceClient {

    private static final Logger log = LoggerFactory.getLogger(PersistenceClient.class);

    static final String SERVICE = "persistence";

    // The record API accepts at most 10 records per create call.
    private static final int RECORDS_PER_REQUEST = 10;

    /** Counts of one write pass. */
    public record WriteReport(int written, int failed, boolean skipped) {
        public static WriteReport skippedReport() {
            return new WriteReport(0, 0, true);
        }
    }

    /**
     * Overrides read from the batch-settings table. Either field is null when
     * the table does not set it (or could not be read).
     */
    public record BatchSettings(Integer numPrompts, String renderer) {
        public static BatchSettings none() {
            return new BatchSettings(null, null);
        }
    }

    private final JsonHttpTransport http;
    private final ServiceCaller     caller;
    private final OrchestratorProperties.Persistence config;
    private final ServiceCallPolicy policy;
    private final ServiceCallPolicy createPolicy;

    public PersistenceClient(OrchestratorProperties properties,
                             JsonHttpTransport http,
                             ServiceCaller caller) {
        this.http         = http;
        this.caller       = caller;
        this.config       = properties.persistence();
        this.policy       = new ServiceCallPolicy(properties.timeouts().persistence(),
                                                  properties.retry().maxAttempts());
        this.createPolicy = ServiceCallPolicy.creating(properties.timeouts().persistence(),
                                                       properties.retry().maxAttempts());
    }

    public boolean enabled() {
        return config.enabled();
    }

    // ------------------------------------------------------------------
    // Structure scores
    // ------------------------------------------------------------------

    /**
     * Write every score as {@code optimizer_score} on its structure record,
     * one PATCH per entity.
     */
    public WriteReport writeScores(ScoreSet scores) {
        if (!enabled()) {
            log.warn("No persistence API key, skipping {} score writes", scores.size());
            return WriteReport.skippedReport();
        }
        int written = 0;
        int failed  = 0;
        for (Map.Entry<String, Double> e : scores.scores().entrySet()) {
            String url = tableUrl(config.structuresTable()) + "/" + e.getKey();
            Map<String, Object> body = Map.of("fields", Map.of("optimizer_score", e.getValue()));
            try {
                caller.execute(SERVICE, "write_score", policy, () ->
                        http.send("PATCH", url, body, authHeaders(), policy.timeout(),
                                  "persistence score write " + e.getKey()));
                written++;
            } catch (ServiceException ex) {
                failed++;
                log.warn("Score write failed for structure {}: {}", e.getKey(), ex.getMessage());
            }
        }
        log.info("Persisted {} of {} structure scores", written, scores.size());
        return new WriteReport(written, failed, false);
    }

    // ------------------------------------------------------------------
    // Prompts
    // ------------------------------------------------------------------

    /**
     * Create one prompts-table record per generated prompt, then one
     * history-table record per created prompt. The report counts prompt
     * records; history failures are only logged.
     */
    public WriteReport writePrompts(List<GeneratedPrompt> prompts) {
        if (!enabled()) {
            log.warn("No persistence API key, skipping {} prompt writes", prompts.size());
            return WriteReport.skippedReport();
        }

        int written = 0;
        int failed  = 0;
        List<PersistenceRecords.StoredRecord> created = new ArrayList<>();

        for (List<GeneratedPrompt> chunk : chunks(prompts)) {
            List<PersistenceRecords.Fields> records = chunk.stream()
                    .map(p -> new PersistenceRecords.Fields(promptFields(p)))
                    .toList();
            try {
                PersistenceRecords.RecordList resp = create(config.promptsTable(), records, "prompts");
                created.addAll(resp.records());
                written += resp.records().size();
                log.info("Wrote batch of {} prompts to prompts table", resp.records().size());
            } catch (ServiceException e) {
                failed += chunk.size();
                log.error("Failed to write prompt batch: {}", e.getMessage());
            }
        }

        int historyWritten = 0;
        for (List<PersistenceRecords.StoredRecord> chunk : chunks(created)) {
            List<PersistenceRecords.Fields> records = chunk.stream()
                    .map(c -> new PersistenceRecords.Fields(historyFields(c)))
                    .toList();
            try {
                historyWritten += create(config.historyTable(), records, "history").records().size();
            } catch (ServiceException e) {
                log.error("Failed to write history batch: {}", e.getMessage());
            }
        }

        log.info("Persistence write complete: {} prompts, {} history records", written, historyWritten);
        return new WriteReport(written, failed, false);
    }

    // ------------------------------------------------------------------
    // Batch settings
    // ------------------------------------------------------------------

    /**
     * Read {@code numPrompts} and {@code renderer} from the first record of
     * the batch-settings table. Never throws: without an API key, without a
     * record, or on any failure the result is {@link BatchSettings#none()}
     * and the caller keeps its configured defaults.
     */
    public BatchSettings readBatchSettings() {
        if (!enabled()) {
            log.warn("No persistence API key, using configured batch settings");
            return BatchSettings.none();
        }
        String url = tableUrl(config.settingsTable()) + "?maxRecords=1";
        try {
            String body = caller.execute(SERVICE, "read_settings", policy, () ->
                    http.send("GET", url, null, authHeaders(), policy.timeout(), "persistence batch settings"));
            List<PersistenceRecords.StoredRecord> records =
                    http.read(body, PersistenceRecords.RecordList.class, "persistence batch settings").records();
            if (records.isEmpty()) {
                log.warn("No batch settings record found, using configured batch settings");
                return BatchSettings.none();
            }
            Map<String, Object> fields = records.get(0).fields();
            BatchSettings settings = new BatchSettings(positiveInt(fields.get("numPrompts")),
                                                       nonBlank(fields.get("renderer")));
            log.info("Batch settings: numPrompts={}, renderer={}", settings.numPrompts(), settings.renderer());
            return settings;
        } catch (ServiceException e) {
            log.error("Failed to fetch batch settings, using configured batch settings: {}", e.getMessage());
            return BatchSettings.none();
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private PersistenceRecords.RecordList create(String table,
                                                     List<PersistenceRecords.Fields> records,
                                                     String what) {
        PersistenceRecords.CreateRequest req = new PersistenceRecords.CreateRequest(records);
        String body = caller.execute(SERVICE, "create_" + what, createPolicy, () ->
                http.send("POST", tableUrl(table), req, authHeaders(), createPolicy.timeout(),
                          "persistence create " + what));
        return http.read(body, PersistenceRecords.RecordList.class, "persistence create " + what);
    }

    /** Linked-record fields must be arrays of record ids. */
    private static Map<String, Object> promptFields(GeneratedPrompt p) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("New Prompt", p.promptText() == null ? "" : p.promptText());
        fields.put("Renderer",   p.renderer()   == null ? "" : p.renderer());
        if (p.designerId() != null)        fields.put("Designer",         List.of(p.designerId()));
        if (p.garmentId() != null)         fields.put("Garment",          List.of(p.garmentId()));
        if (p.promptStructureId() != null) fields.put("Prompt Structure", List.of(p.promptStructureId()));
        return fields;
    }

    private static Map<String, Object> historyFields(PersistenceRecords.StoredRecord c) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("Prompt ID", c.id());
        fields.put("Prompt",    c.fields().getOrDefault("New Prompt", ""));
        fields.put("Renderer",  c.fields().getOrDefault("Renderer", ""));
        for (String linked : List.of("Designer", "Garment", "Prompt Structure")) {
            Object value = c.fields().get(linked);
            if (value != null) fields.put(linked, value);
        }
        return fields;
    }

    private String tableUrl(String table) {
        return config.baseUrl() + "/" + table.replace(" ", "%20");
    }

    private static Integer positiveInt(Object value) {
        if (value instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        if (value != null) {
            log.warn("Ignoring batch setting numPrompts={}", value);
        }
        return null;
    }

    private static String nonBlank(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + config.apiKey());
    }

    private static <T> List<List<T>> chunks(List<T> items) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += RECORDS_PER_REQUEST) {
            out.add(items.subList(i, Math.min(items.size(), i + RECORDS_PER_REQUEST)));
        }
        return out;
    }
}
