package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.client.GeneratorClient;
import com.anatomie.orchestrator.client.OptimizerClient;
import com.anatomie.orchestrator.client.PersistenceClient;
import com.anatomie.orchestrator.client.ServiceException;
import com.anatomie.orchestrator.client.dto.InsightsResponse;
import com.anatomie.orchestrator.client.dto.ScoreStructuresResponse;
import com.anatomie.orchestrator.client.dto.UpdatePreferencesRequest;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import com.anatomie.orchestrator.model.LearningCycleResult;
import com.anatomie.orchestrator.model.OrchestratorState;
import com.anatomie.orchestrator.model.PipelineRun;
import com.anatomie.orchestrator.model.RunKind;
import com.anatomie.orchestrator.model.ScoreSet;
import com.anatomie.orchestrator.model.StageName;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the learning cycle: train → score → insights → update_preferences →
 * persist_scores, stopping at the first failed stage.
 *
 * At most one cycle runs at a time in this process. The guard below is
 * separate from the state lock and is never held across a network call:
 * it only protects the {@link #inFlight} handle. Callers that arrive while
 * a cycle runs wait on that handle. A forced caller takes the in-flight
 * result as its own; a threshold caller checks the like counter again once
 * the running cycle has committed.
 *
 * Stage failures never throw out of {@link #runLearningCycle(boolean)}; they
 * come back in the {@link LearningCycleResult}.
 */
@Service
public class LearningCycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LearningCycleCoordinator.class);

    private final OrchestratorState state;
    private final OptimizerClient   optimizer;
    private final GeneratorClient   generator;
    private final PersistenceClient persistence;
    private final Clock             clock;
    private final MeterRegistry     meterRegistry;
    private final Executor          executor;
    private final int               likeThreshold;
    private final double            explorationRate;

    private final ReentrantLock guard = new ReentrantLock();
    private CompletableFuture<LearningCycleResult> inFlight;   // guarded by guard

    public LearningCycleCoordinator(OrchestratorProperties properties,
                                    OrchestratorState state,
                                    OptimizerClient optimizer,
                                    GeneratorClient generator,
                                    PersistenceClient persistence,
                                    Clock clock,
                                    MeterRegistry meterRegistry,
                                    @Qualifier("learningCycleExecutor") Executor executor) {
        this.state           = state;
        this.optimizer       = optimizer;
        this.generator       = generator;
        this.persistence     = persistence;
        this.clock           = clock;
        this.meterRegistry   = meterRegistry;
        this.executor        = executor;
        this.likeThreshold   = properties.learning().likeThreshold();
        this.explorationRate = properties.learning().explorationRate();
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Run a learning cycle if the like threshold is reached or
     * {@code forceRetrain} is set. Blocks until the cycle (own or joined)
     * has finished.
     */
    public LearningCycleResult runLearningCycle(boolean forceRetrain) {
        while (true) {
            CompletableFuture<LearningCycleResult> running;
            CompletableFuture<LearningCycleResult> owned = null;

            guard.lock();
            try {
                running = inFlight;
                if (running == null) {
                    if (!forceRetrain && state.likesSinceLastRetrain() < likeThreshold) {
                        return LearningCycleResult.notTriggered();
                    }
                    owned    = new CompletableFuture<>();
                    inFlight = owned;
                }
            } finally {
                guard.unlock();
            }

            if (owned != null) {
                return runOwned(owned, forceRetrain);
            }

            log.info("Learning cycle already running, waiting for it to finish");
            LearningCycleResult joined = await(running);
            if (forceRetrain && joined.retrainTriggered()) {
                return joined.asJoined();
            }
            // Threshold caller: the finished cycle may have consumed the likes.
            // A reserved slot that never ran also lands here.
        }
    }

    /** True while a cycle is running in this process. */
    public boolean isCycleRunning() {
        guard.lock();
        try {
            return inFlight != null;
        } finally {
            guard.unlock();
        }
    }

    /**
     * Start a forced cycle in the background (POST /trigger_retrain).
     * The in-flight slot is taken before the task is queued, so a second
     * trigger sees it even if the executor has not started the first one.
     *
     * @return false when a cycle is already running or the executor is full
     */
    public boolean triggerAsync() {
        CompletableFuture<LearningCycleResult> owned = new CompletableFuture<>();
        guard.lock();
        try {
            if (inFlight != null) {
                log.info("Manual retrain requested but a learning cycle is already running");
                return false;
            }
            inFlight = owned;
        } finally {
            guard.unlock();
        }

        try {
            executor.execute(() -> runOwned(owned, true));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Learning cycle executor rejected the task: {}", e.getMessage());
            releaseSlot();
            owned.complete(LearningCycleResult.notTriggered());
            return false;
        }
    }

    /**
     * Hand a cycle to the learning-cycle executor and return immediately.
     * The cycle still goes through the single-flight guard when it starts.
     */
    public boolean dispatch(boolean forceRetrain) {
        try {
            executor.execute(() -> runLearningCycle(forceRetrain));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Learning cycle executor rejected the task: {}", e.getMessage());
            return false;
        }
    }

    public int likeThreshold() {
        return likeThreshold;
    }

    public double explorationRate() {
        return explorationRate;
    }

    // ------------------------------------------------------------------
    // Cycle execution
    // ------------------------------------------------------------------

    private LearningCycleResult runOwned(CompletableFuture<LearningCycleResult> owned, boolean forced) {
        LearningCycleResult result = null;
        RuntimeException    failure = null;
        try {
            result = executeCycle(forced);
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            // Clear before completing so woken waiters do not join this run again.
            releaseSlot();
        }

        if (failure != null) {
            owned.completeExceptionally(failure);
            throw failure;
        }
        owned.complete(result);
        return result;
    }

    private void releaseSlot() {
        guard.lock();
        try {
            inFlight = null;
        } finally {
            guard.unlock();
        }
    }

    /** Values handed from one stage to the next. */
    private static final class CycleData {
        ScoreStructuresResponse scored;
        ScoreSet                scores;
        InsightsResponse        insights;
    }

    private LearningCycleResult executeCycle(boolean forced) {
        PipelineRun run = new PipelineRun(RunKind.LEARNING_CYCLE, Stages.newRunId(), clock.instant());
        CycleData   data = new CycleData();
        int likesAtStart = state.beginCycle();

        try (RunLogContext ignored = RunLogContext.open(run)) {
            log.info("Starting learning cycle (likes={}, threshold={}, forced={})",
                    likesAtStart, likeThreshold, forced);
            try {
                runStages(run, data);
            } finally {
                run.finish(clock.instant());
                commit(run, data, likesAtStart);
            }

            LearningCycleResult result = LearningCycleResult.from(run);
            meterRegistry.counter("anatomie.learning.cycles",
                    "outcome", result.success() ? "success" : "failed").increment();
            if (result.success()) {
                log.info("Learning cycle completed");
            } else {
                log.warn("Learning cycle failed at {}: {}", result.failedStage(), result.error());
            }
            return result;
        }
    }

    /** Stops at the first failed stage; later stages stay PENDING. */
    private void runStages(PipelineRun run, CycleData data) {
        if (!Stages.run(run, StageName.TRAIN, "Training optimizer", clock, optimizer::train)) {
            return;
        }
        if (!Stages.run(run, StageName.SCORE, "Scoring structures", clock, () -> {
            data.scored = optimizer.scoreStructures();
            data.scores = ScoreSet.fromStructures(data.scored, clock.instant());
        })) {
            return;
        }
        if (!Stages.run(run, StageName.INSIGHTS, "Fetching structure prompt insights", clock,
                () -> data.insights = optimizer.structurePromptInsights())) {
            return;
        }
        if (!Stages.run(run, StageName.UPDATE_PREFERENCES, "Updating generator preferences", clock,
                () -> generator.updatePreferences(new UpdatePreferencesRequest(
                        data.scored.global_preference_vector(),
                        explorationRate,
                        data.scores.scores(),
                        data.insights.insights())))) {
            return;
        }
        if (Stages.run(run, StageName.PERSIST_SCORES, "Writing scores to persistence", clock,
                () -> persistScores(data.scores))) {
            log.info("All {} learning cycle steps succeeded", run.stageCount());
        }
    }

    private void persistScores(ScoreSet scores) {
        PersistenceClient.WriteReport report = persistence.writeScores(scores);
        if (report.skipped()) {
            log.warn("Score persistence skipped: no API key configured");
            return;
        }
        if (report.failed() > 0) {
            throw new ServiceException(ServiceException.Kind.COLLABORATOR,
                    report.failed() + " of " + scores.size() + " score writes failed");
        }
    }

    /** One state update per cycle, whatever the outcome. */
    private void commit(PipelineRun run, CycleData data, int likesAtStart) {
        boolean trained    = run.outcome(StageName.TRAIN).ok();
        ScoreSet freshScores = run.outcome(StageName.SCORE).ok() ? data.scores : null;
        String error = run.firstFailure()
                .map(f -> "Learning cycle failed at " + f.stage().wireName() + ": " + f.error())
                .orElse(null);
        state.commitCycle(new OrchestratorState.CycleCommit(trained, likesAtStart, freshScores, error));
    }

    private static LearningCycleResult await(CompletableFuture<LearningCycleResult> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw e;
        }
    }
}
