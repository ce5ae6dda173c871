package com.anatomie.orchestrator.model;

/** Outcome of a daily batch; summary is the human-readable line for the e-mail. */
public record BatchResult(
        boolean     success,
        boolean     retrainTriggered,
        int         ideasGenerated,
        int         promptsGenerated,
        int         promptsWritten,
        String      summary,
        String      error,
        PipelineRun run
) {}
