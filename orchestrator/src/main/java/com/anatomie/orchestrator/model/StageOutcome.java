package com.anatomie.orchestrator.model;

import java.time.Instant;

/** One entry of a {@link PipelineRun}. error is set only when FAILED. */
public record StageOutcome(
        StageName   stage,
        StageStatus status,
        String      error,
        Instant     startedAt,
        Instant     finishedAt
) {
    public static StageOutcome pending(StageName stage) {
        return new StageOutcome(stage, StageStatus.PENDING, null, null, null);
    }

    public boolean ok()     { return status == StageStatus.OK; }
    public boolean failed() { return status == StageStatus.FAILED; }
}
