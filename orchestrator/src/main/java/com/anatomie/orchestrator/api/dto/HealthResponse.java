package com.anatomie.orchestrator.api.dto;

/** Brief state for GET /health. Full detail lives under GET /status. */
public record HealthResponse(
        String  status,
        int     likesSinceLastRetrain,
        int     threshold,
        boolean retraining,
        int     totalBatches,
        int     totalGenerations
) {}
