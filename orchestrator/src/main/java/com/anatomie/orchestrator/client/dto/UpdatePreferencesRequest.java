package com.anatomie.orchestrator.client.dto;

import java.util.Map;

/**
 * Request body for POST /update_preferences on the generator.
 * exploration_rate is passed through from configuration untouched.
 */
public record UpdatePreferencesRequest(
        Map<String, Object> global_preference_vector,
        double              exploration_rate,
        Map<String, Double> structure_scores,
        Map<String, Object> structure_prompt_insights
) {}
