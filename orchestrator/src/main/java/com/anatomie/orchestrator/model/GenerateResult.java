package com.anatomie.orchestrator.model;

/** Outcome of a manual prompt generation. */
public record GenerateResult(
        boolean     success,
        boolean     retrainTriggered,
        int         promptsGenerated,
        int         promptsWritten,
        String      renderer,
        String      error,
        PipelineRun run
) {}
