package com.anatomie.orchestrator.api.dto;

import com.anatomie.orchestrator.model.BatchResult;

/**
 * Response body for POST /events/daily_batch. summary is ready to paste
 * into the daily e-mail.
 */
public record DailyBatchResponse(
        boolean success,
        boolean retrainTriggered,
        int     ideasGenerated,
        int     promptsGenerated,
        int     promptsWritten,
        String  summary,
        String  error
) {
    public static DailyBatchResponse from(BatchResult r) {
        return new DailyBatchResponse(
                r.success(),
                r.retrainTriggered(),
                r.ideasGenerated(),
                r.promptsGenerated(),
                r.promptsWritten(),
                r.summary(),
                r.error()
        );
    }
}
