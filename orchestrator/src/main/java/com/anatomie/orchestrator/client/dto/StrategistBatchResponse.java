package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** Response from POST /api/batch/run; only the generated count matters here. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategistBatchResponse(Integer totalGenerated) {

    public int generatedOrZero() {
        return totalGenerated == null ? 0 : Math.max(0, totalGenerated);
    }
}
