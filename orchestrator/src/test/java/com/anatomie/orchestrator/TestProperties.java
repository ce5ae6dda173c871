package com.anatomie.orchestrator;

import com.anatomie.orchestrator.config.OrchestratorProperties;

import java.time.Duration;

/**
 * OrchestratorProperties for tests: short timeouts, 1 ms backoff, no chunk
 * delay, persistence disabled unless an API key is given.
 */
public final class TestProperties {

    public static final String SERVICE_URL     = "http://collaborator.test";
    public static final String PERSISTENCE_URL = "http://persistence.test/v0/base";

    private TestProperties() {}

    static final Duration TIMEOUT = Duration.ofSeconds(5);

    public static OrchestratorProperties defaults() {
        return build(SERVICE_URL, PERSISTENCE_URL, "", 25, TIMEOUT);
    }

    public static OrchestratorProperties withThreshold(int likeThreshold) {
        return build(SERVICE_URL, PERSISTENCE_URL, "", likeThreshold, TIMEOUT);
    }

    /** All three ML collaborators at one base URL, e.g. a local HttpServer. */
    public static OrchestratorProperties withServiceUrl(String url) {
        return build(url, PERSISTENCE_URL, "", 25, TIMEOUT);
    }

    /** As {@link #withServiceUrl(String)}, with every call timeout set to {@code timeout}. */
    public static OrchestratorProperties withServiceUrl(String url, Duration timeout) {
        return build(url, PERSISTENCE_URL, "", 25, timeout);
    }

    public static OrchestratorProperties withPersistence(String baseUrl, String apiKey) {
        return build(SERVICE_URL, baseUrl, apiKey, 25, TIMEOUT);
    }

    private static OrchestratorProperties build(String serviceUrl,
                                                String persistenceUrl,
                                                String apiKey,
                                                int likeThreshold,
                                                Duration timeout) {
        return new OrchestratorProperties(
                new OrchestratorProperties.Services(serviceUrl, serviceUrl, serviceUrl),
                new OrchestratorProperties.Persistence(persistenceUrl, apiKey,
                        "tblStructures", "Prompts", "History", "Daily Batch Settings"),
                new OrchestratorProperties.Learning(likeThreshold, 0.2),
                new OrchestratorProperties.Batch(3, 30, "ImageFX", 10, Duration.ZERO),
                new OrchestratorProperties.Scores(Duration.ofHours(24)),
                new OrchestratorProperties.Timeouts(timeout, timeout, timeout, timeout, timeout, timeout, timeout),
                new OrchestratorProperties.Retry(3, Duration.ofMillis(1), 2.0));
    }
}
