package com.anatomie.orchestrator.model;

/**
 * Structured outcome of a learning-cycle request. Stage failures end up here
 * instead of being thrown.
 *
 * @param success          every stage succeeded
 * @param retrainTriggered a cycle actually ran for this request (or was joined)
 * @param failedStage      wire name of the first failed stage, null if none
 * @param error            message of that failure, null if none
 * @param joinedInFlight   this forced request was satisfied by a cycle that
 *                         was already running when it arrived
 * @param run              stage-by-stage record, null when no cycle ran
 */
public record LearningCycleResult(
        boolean     success,
        boolean     retrainTriggered,
        String      failedStage,
        String      error,
        boolean     joinedInFlight,
        PipelineRun run
) {
    /** Nothing to do: below threshold and not forced. */
    public static LearningCycleResult notTriggered() {
        return new LearningCycleResult(true, false, null, null, false, null);
    }

    public static LearningCycleResult from(PipelineRun run) {
        return run.firstFailure()
                .map(f -> new LearningCycleResult(false, true, f.stage().wireName(), f.error(), false, run))
                .orElseGet(() -> new LearningCycleResult(run.isOverallSuccess(), true, null, null, false, run));
    }

    /** The same outcome, as seen by a caller that waited on it. */
    public LearningCycleResult asJoined() {
        return new LearningCycleResult(success, retrainTriggered, failedStage, error, true, run);
    }
}
