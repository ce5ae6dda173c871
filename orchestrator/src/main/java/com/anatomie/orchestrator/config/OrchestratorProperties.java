package com.anatomie.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;

/**
 * All tunables of the orchestrator, bound from the {@code anatomie.*} tree in
 * application.yml. Every leaf there has an environment-variable override
 * (LIKE_THRESHOLD, OPTIMIZER_SERVICE_URL, ...).
 *
 * Validation runs in the compact constructors: a blank or malformed service
 * URL, or a non-positive count, aborts startup with a
 * {@link ConfigurationException}.
 */
@ConfigurationProperties(prefix = "anatomie")
public record OrchestratorProperties(
        Services    services,
        Persistence persistence,
        Learning    learning,
        Batch       batch,
        Scores      scores,
        Timeouts    timeouts,
        Retry       retry
) {

    public OrchestratorProperties {
        require(services,    "anatomie.services");
        require(persistence, "anatomie.persistence");
        require(learning,    "anatomie.learning");
        require(batch,       "anatomie.batch");
        require(scores,      "anatomie.scores");
        require(timeouts,    "anatomie.timeouts");
        require(retry,       "anatomie.retry");
    }

    /** Base URLs of the three ML collaborators. */
    public record Services(String optimizerUrl, String generatorUrl, String strategistUrl) {
        public Services {
            optimizerUrl  = validUrl(optimizerUrl,  "anatomie.services.optimizer-url");
            generatorUrl  = validUrl(generatorUrl,  "anatomie.services.generator-url");
            strategistUrl = validUrl(strategistUrl, "anatomie.services.strategist-url");
        }
    }

    /**
     * Persistence backend (Airtable-style REST). Reads and writes are skipped
     * when no API key is configured; the URL is still validated.
     */
    public record Persistence(String baseUrl,
                              String apiKey,
                              String structuresTable,
                              String promptsTable,
                              String historyTable,
                              String settingsTable) {
        public Persistence {
            baseUrl = validUrl(baseUrl, "anatomie.persistence.base-url");
            if (apiKey == null) apiKey = "";
            if (settingsTable == null || settingsTable.isBlank()) settingsTable = "Daily Batch Settings";
        }

        public boolean enabled() {
            return !apiKey.isBlank();
        }
    }

    public record Learning(int likeThreshold, double explorationRate) {
        public Learning {
            if (likeThreshold <= 0) {
                throw new ConfigurationException(
                        "anatomie.learning.like-threshold must be positive, got " + likeThreshold);
            }
        }
    }

    public record Batch(int defaultIdeas,
                        int defaultNumPrompts,
                        String defaultRenderer,
                        int generatorBatchSize,
                        Duration generatorBatchDelay) {
        public Batch {
            if (defaultIdeas <= 0 || defaultNumPrompts <= 0 || generatorBatchSize <= 0) {
                throw new ConfigurationException(
                        "anatomie.batch counts must be positive (ideas=%d, prompts=%d, chunk=%d)"
                                .formatted(defaultIdeas, defaultNumPrompts, generatorBatchSize));
            }
            if (defaultRenderer == null || defaultRenderer.isBlank()) {
                throw new ConfigurationException("anatomie.batch.default-renderer is required");
            }
            if (generatorBatchDelay == null) generatorBatchDelay = Duration.ZERO;
        }
    }

    /** Score cache staleness bound. */
    public record Scores(Duration maxAge) {
        public Scores {
            require(maxAge, "anatomie.scores.max-age");
        }
    }

    public record Timeouts(Duration train,
                           Duration score,
                           Duration update,
                           Duration strategist,
                           Duration generator,
                           Duration persistence,
                           Duration warmUp) {
        public Timeouts {
            require(train,       "anatomie.timeouts.train");
            require(score,       "anatomie.timeouts.score");
            require(update,      "anatomie.timeouts.update");
            require(strategist,  "anatomie.timeouts.strategist");
            require(generator,   "anatomie.timeouts.generator");
            require(persistence, "anatomie.timeouts.persistence");
            require(warmUp,      "anatomie.timeouts.warm-up");
        }
    }

    /** Retry policy for transient failures; Train ignores it and runs once. */
    public record Retry(int maxAttempts, Duration initialBackoff, double multiplier) {
        public Retry {
            if (maxAttempts <= 0) {
                throw new ConfigurationException("anatomie.retry.max-attempts must be positive");
            }
            require(initialBackoff, "anatomie.retry.initial-backoff");
            if (multiplier < 1.0) {
                throw new ConfigurationException("anatomie.retry.multiplier must be >= 1.0");
            }
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void require(Object value, String key) {
        if (value == null) {
            throw new ConfigurationException(key + " is required");
        }
    }

    /** Accepts http(s) URLs only; strips a trailing slash so paths can be appended. */
    private static String validUrl(String url, String key) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException(key + " is required");
        }
        String trimmed = url.strip();
        try {
            URI uri = URI.create(trimmed);
            String scheme = uri.getScheme();
            if (uri.getHost() == null || !("http".equals(scheme) || "https".equals(scheme))) {
                throw new ConfigurationException(key + " must be an http(s) URL, got '" + url + "'");
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(key + " is not a valid URL: '" + url + "'");
        }
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
