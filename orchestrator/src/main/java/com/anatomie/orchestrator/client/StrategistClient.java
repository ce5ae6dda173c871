package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.client.dto.StrategistBatchRequest;
import com.anatomie.orchestrator.client.dto.StrategistBatchResponse;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import com.anatomie.orchestrator.model.ScoreSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * HTTP client for the strategist (idea generator).
 */
@Component
public class StrategistClient {

    private static final Logger log = LoggerFactory.getLogger(StrategistClient.class);

    static final String SERVICE = "strategist";

    private final JsonHttpTransport http;
    private final ServiceCaller     caller;
    private final String            baseUrl;
    private final ServiceCallPolicy policy;
    private final Duration          warmUpTimeout;

    public StrategistClient(OrchestratorProperties properties,
                            JsonHttpTransport http,
                            ServiceCaller caller) {
        this.http          = http;
        this.caller        = caller;
        this.baseUrl       = properties.services().strategistUrl();
        this.policy        = ServiceCallPolicy.creating(properties.timeouts().strategist(),
                                                        properties.retry().maxAttempts());
        this.warmUpTimeout = properties.timeouts().warmUp();
    }

    /**
     * Ask for {@code numIdeas} new structure ideas (POST /api/batch/run).
     *
     * @return how many ideas the strategist reports as generated
     */
    public int generateIdeas(int numIdeas, double explorationRate, ScoreSet scores) {
        StrategistBatchRequest req = new StrategistBatchRequest(numIdeas, explorationRate, scores.scores());
        String body = caller.execute(SERVICE, "batch_run", policy, () ->
                http.post(baseUrl + "/api/batch/run", req, policy.timeout(), "strategist batch run"));
        int generated = http.read(body, StrategistBatchResponse.class, "strategist batch run").generatedOrZero();
        log.info("Strategist generated {} ideas (requested {})", generated, numIdeas);
        return generated;
    }

    /** Best-effort wake-up of a sleeping host. Returns true when healthy. */
    public boolean warmUp() {
        return WarmUp.ping(http, SERVICE, baseUrl + "/api/health", warmUpTimeout);
    }
}
