package com.anatomie.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

/** Request body for POST /events/manual_generate. */
public record ManualGenerateRequest(
        @JsonAlias("num_prompts")   Integer numPrompts,
        String renderer,
        @JsonAlias("force_retrain") Boolean forceRetrain
) {
    public static ManualGenerateRequest defaults() {
        return new ManualGenerateRequest(null, null, false);
    }

    public boolean forced() {
        return Boolean.TRUE.equals(forceRetrain);
    }
}
