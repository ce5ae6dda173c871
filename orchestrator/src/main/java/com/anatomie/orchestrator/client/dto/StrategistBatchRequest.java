package com.anatomie.orchestrator.client.dto;

import java.util.Map;

/** Request body for POST /api/batch/run on the strategist. */
public record StrategistBatchRequest(
        int                 num_ideas,
        double              exploration_rate,
        Map<String, Double> structure_scores
) {}
