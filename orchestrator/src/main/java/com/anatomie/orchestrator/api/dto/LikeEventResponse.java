package com.anatomie.orchestrator.api.dto;

import com.anatomie.orchestrator.model.LikeResult;

public record LikeEventResponse(
        String  status,
        int     likesSinceLastRetrain,
        int     threshold,
        boolean thresholdReached,
        boolean retrainTriggered,
        String  message
) {
    public static LikeEventResponse from(LikeResult r) {
        return new LikeEventResponse(
                r.status(),
                r.likesSinceLastRetrain(),
                r.threshold(),
                r.thresholdReached(),
                r.retrainTriggered(),
                r.message()
        );
    }
}
