package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.model.PipelineRun;
import com.anatomie.orchestrator.model.StageName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs one stage of a {@link PipelineRun} and records its outcome.
 *
 * A stage fails when its body throws; the exception never escapes, it
 * becomes the stage's error message. Callers check the returned flag and
 * return early to stop at the first failure.
 */
final class Stages {

    private static final Logger log = LoggerFactory.getLogger(Stages.class);

    private Stages() {}

    static boolean run(PipelineRun run, StageName stage, String label, Clock clock, Runnable body) {
        int step  = run.positionOf(stage);
        int total = run.stageCount();
        log.info("Step {}/{}: {}...", step, total, label);

        Instant started = clock.instant();
        try {
            body.run();
            run.succeed(stage, started, clock.instant());
            return true;
        } catch (RuntimeException e) {
            String error = describe(e);
            log.error("Step {}/{} ({}) failed: {}", step, total, stage.wireName(), error);
            run.fail(stage, error, started, clock.instant());
            return false;
        }
    }

    static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /** Short id for correlating log lines of one run. */
    static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
