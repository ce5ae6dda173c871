package com.anatomie.orchestrator.model;

/**
 * Outcome of a like event.
 *
 * @param status one of "recorded" or "threshold_reached"
 */
public record LikeResult(
        String  status,
        int     likesSinceLastRetrain,
        int     threshold,
        boolean thresholdReached,
        boolean retrainTriggered,
        String  message
) {}
