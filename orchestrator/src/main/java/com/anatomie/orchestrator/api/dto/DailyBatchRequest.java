package com.anatomie.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Request body for POST /events/daily_batch. Omitted counts and renderer
 * fall back to the configured defaults.
 */
public record DailyBatchRequest(
        @JsonAlias("force_retrain") Boolean forceRetrain,
        @JsonAlias("num_ideas")     Integer numIdeas,
        @JsonAlias("num_prompts")   Integer numPrompts,
        String renderer
) {
    public static DailyBatchRequest defaults() {
        return new DailyBatchRequest(false, null, null, null);
    }

    public boolean forced() {
        return Boolean.TRUE.equals(forceRetrain);
    }
}
