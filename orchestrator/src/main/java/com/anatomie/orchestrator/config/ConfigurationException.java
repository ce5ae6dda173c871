package com.anatomie.orchestrator.config;

/**
 * Thrown while binding {@link OrchestratorProperties} when a required setting
 * is missing or invalid. Spring surfaces it during context refresh, so the
 * application refuses to start instead of failing per request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
