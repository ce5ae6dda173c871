package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Response from GET /structure_prompt_insights on the optimizer.
 * The insight payload per structure is opaque to the orchestrator.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightsResponse(String status, Map<String, Object> insights) {
    public InsightsResponse {
        if (insights == null) insights = Map.of();
    }
}
