package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.client.dto.InsightsResponse;
import com.anatomie.orchestrator.client.dto.ScoreStructuresResponse;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * HTTP client for the optimizer service (trainer, scorer, insights).
 *
 * Training is not idempotent as far as we know, so {@link #train()} runs
 * exactly once per call; the read-only endpoints use the normal retry policy.
 */
@Component
public class OptimizerClient {

    private static final Logger log = LoggerFactory.getLogger(OptimizerClient.class);

    static final String SERVICE = "optimizer";

    private final JsonHttpTransport http;
    private final ServiceCaller     caller;
    private final String            baseUrl;
    private final ServiceCallPolicy trainPolicy;
    private final ServiceCallPolicy scorePolicy;

    public OptimizerClient(OrchestratorProperties properties,
                           JsonHttpTransport http,
                           ServiceCaller caller) {
        this.http        = http;
        this.caller      = caller;
        this.baseUrl     = properties.services().optimizerUrl();
        this.trainPolicy = ServiceCallPolicy.once(properties.timeouts().train());
        this.scorePolicy = new ServiceCallPolicy(properties.timeouts().score(),
                                                 properties.retry().maxAttempts());
    }

    /** Retrain the model on the latest feedback (POST /train). Never retried. */
    public void train() {
        log.info("Training optimizer at {}", baseUrl);
        caller.execute(SERVICE, "train", trainPolicy, () ->
                http.post(baseUrl + "/train", Map.of(), trainPolicy.timeout(), "optimizer train"));
    }

    /** Score every structure (POST /score_structures). */
    public ScoreStructuresResponse scoreStructures() {
        String body = caller.execute(SERVICE, "score_structures", scorePolicy, () ->
                http.post(baseUrl + "/score_structures", Map.of(), scorePolicy.timeout(),
                          "optimizer score_structures"));
        ScoreStructuresResponse resp = http.read(body, ScoreStructuresResponse.class, "optimizer score_structures");
        log.info("Optimizer returned {} structure scores", resp.structures().size());
        return resp;
    }

    /** Per-structure prompt insights (GET /structure_prompt_insights). */
    public InsightsResponse structurePromptInsights() {
        String body = caller.execute(SERVICE, "structure_prompt_insights", scorePolicy, () ->
                http.get(baseUrl + "/structure_prompt_insights", scorePolicy.timeout(),
                         "optimizer structure_prompt_insights"));
        return http.read(body, InsightsResponse.class, "optimizer structure_prompt_insights");
    }
}
