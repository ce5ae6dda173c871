package com.anatomie.orchestrator.model;

import java.time.Instant;

/**
 * Consistent, immutable copy of {@link OrchestratorState} taken under its
 * lock. Served by GET /status and GET /health.
 */
public record StateSnapshot(
        int     likesSinceLastRetrain,
        Instant lastRetrainAt,
        Instant lastLikeAt,
        int     totalRetrains,
        long    totalLikesProcessed,
        boolean retraining,
        String  lastError,
        Instant lastBatchAt,
        int     totalBatches,
        String  lastBatchSummary,
        Instant lastGenerationAt,
        int     totalGenerations,
        String  lastGenerationSummary,
        Instant scoresCachedAt,
        int     cachedScoresCount
) {}
