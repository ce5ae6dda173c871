package com.anatomie.orchestrator.api.dto;

import com.anatomie.orchestrator.model.GenerateResult;

public record ManualGenerateResponse(
        boolean success,
        boolean retrainTriggered,
        int     promptsGenerated,
        int     promptsWritten,
        String  renderer,
        String  error
) {
    public static ManualGenerateResponse from(GenerateResult r) {
        return new ManualGenerateResponse(
                r.success(),
                r.retrainTriggered(),
                r.promptsGenerated(),
                r.promptsWritten(),
                r.renderer(),
                r.error()
        );
    }
}
