package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.model.PipelineRun;
import org.slf4j.MDC;

/**
 * Puts {@code runKind} and {@code runId} into the MDC for the duration of a
 * pipeline run, then restores whatever was there before.
 */
final class RunLogContext implements AutoCloseable {

    static final String RUN_KIND = "runKind";
    static final String RUN_ID   = "runId";

    private final String previousKind;
    private final String previousId;

    private RunLogContext(PipelineRun run) {
        this.previousKind = MDC.get(RUN_KIND);
        this.previousId   = MDC.get(RUN_ID);
        MDC.put(RUN_KIND, run.getKind().name().toLowerCase());
        MDC.put(RUN_ID,   run.getRunId());
    }

    static RunLogContext open(PipelineRun run) {
        return new RunLogContext(run);
    }

    @Override
    public void close() {
        restore(RUN_KIND, previousKind);
        restore(RUN_ID,   previousId);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
