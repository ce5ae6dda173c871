package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

/**
 * Response from POST /score_structures on the optimizer.
 * Unknown fields are ignored; only the per-structure scores and the global
 * preference vector are forwarded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoreStructuresResponse(
        List<StructureScore> structures,
        Map<String, Object>  global_preference_vector
) {
    public ScoreStructuresResponse {
        if (structures == null) structures = List.of();
        if (global_preference_vector == null) global_preference_vector = Map.of();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StructureScore(String structure_id, Double predicted_success_score) {}
}
