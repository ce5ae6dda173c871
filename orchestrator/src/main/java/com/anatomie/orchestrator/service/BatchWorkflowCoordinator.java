package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.client.GeneratorClient;
import com.anatomie.orchestrator.client.PersistenceClient;
import com.anatomie.orchestrator.client.PersistenceClient.BatchSettings;
import com.anatomie.orchestrator.client.ServiceException;
import com.anatomie.orchestrator.client.StrategistClient;
import com.anatomie.orchestrator.client.dto.GeneratedPrompt;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import com.anatomie.orchestrator.model.BatchResult;
import com.anatomie.orchestrator.model.GenerateResult;
import com.anatomie.orchestrator.model.LearningCycleResult;
import com.anatomie.orchestrator.model.LikeEvent;
import com.anatomie.orchestrator.model.LikeResult;
import com.anatomie.orchestrator.model.OrchestratorState;
import com.anatomie.orchestrator.model.PipelineRun;
import com.anatomie.orchestrator.model.RunKind;
import com.anatomie.orchestrator.model.ScoreSet;
import com.anatomie.orchestrator.model.StageName;
import com.anatomie.orchestrator.model.StageOutcome;
import com.anatomie.orchestrator.model.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daily batch, manual generation and like handling.
 *
 * Each workflow first gives the learning cycle a chance to run (same
 * threshold predicate), then calls the generation services. Idea and prompt
 * generation are independent: a failed idea stage does not stop prompts, and
 * a daily batch only reports failure when both of them failed.
 */
@Service
public class BatchWorkflowCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BatchWorkflowCoordinator.class);

    private final LearningCycleCoordinator learning;
    private final ScoreCache               scoreCache;
    private final OrchestratorState        state;
    private final StrategistClient         strategist;
    private final GeneratorClient          generator;
    private final PersistenceClient        persistence;
    private final Clock                    clock;
    private final OrchestratorProperties.Batch batch;
    private final Duration                 scoreMaxAge;

    public BatchWorkflowCoordinator(OrchestratorProperties properties,
                                    LearningCycleCoordinator learning,
                                    ScoreCache scoreCache,
                                    OrchestratorState state,
                                    StrategistClient strategist,
                                    GeneratorClient generator,
                                    PersistenceClient persistence,
                                    Clock clock) {
        this.learning    = learning;
        this.scoreCache  = scoreCache;
        this.state       = state;
        this.strategist  = strategist;
        this.generator   = generator;
        this.persistence = persistence;
        this.clock       = clock;
        this.batch       = properties.batch();
        this.scoreMaxAge = properties.scores().maxAge();
    }

    // ------------------------------------------------------------------
    // Daily batch
    // ------------------------------------------------------------------

    /**
     * Learning cycle (if needed) → scores → ideas → prompts → write-back.
     * A null prompt count or renderer is taken from the persistence
     * backend's batch-settings table, then from configuration.
     *
     * @throws IllegalArgumentException if a count is zero or negative
     */
    public BatchResult runDailyBatch(boolean forceRetrain, Integer numIdeas, Integer numPrompts, String renderer) {
        int ideasWanted = positiveOrDefault(numIdeas, batch.defaultIdeas(), "numIdeas");
        requirePositive(numPrompts, "numPrompts");

        LearningCycleResult cycle = learning.runLearningCycle(forceRetrain);

        PipelineRun run = new PipelineRun(RunKind.DAILY_BATCH, Stages.newRunId(), clock.instant());
        try (RunLogContext ignored = RunLogContext.open(run)) {
            BatchSettings settings = numPrompts == null || isBlank(renderer)
                    ? persistence.readBatchSettings()
                    : BatchSettings.none();
            int    promptsWanted = positiveOrDefault(numPrompts != null ? numPrompts : settings.numPrompts(),
                                                     batch.defaultNumPrompts(), "numPrompts");
            String rendererUsed  = rendererOrDefault(isBlank(renderer) ? settings.renderer() : renderer);
            log.info("Starting daily batch (ideas={}, prompts={}, renderer={})",
                    ideasWanted, promptsWanted, rendererUsed);

            ScoreSet scores = scoresForBatch();

            AtomicInteger ideas = new AtomicInteger();
            strategist.warmUp();
            Stages.run(run, StageName.IDEAS, "Generating structure ideas", clock, () ->
                    ideas.set(strategist.generateIdeas(ideasWanted, learning.explorationRate(), scores)));

            Generated generated = generateAndWrite(run, promptsWanted, rendererUsed);
            run.finish(clock.instant());

            String summary = summary(cycle, List.of(
                    ideas.get() + " new structure ideas generated",
                    generated.prompts.size() + " prompts created"));
            String  error   = joinErrors(run, StageName.IDEAS, StageName.PROMPTS);
            boolean success = !(run.outcome(StageName.IDEAS).failed() && run.outcome(StageName.PROMPTS).failed());

            state.recordBatch(summary, error);
            if (error == null) {
                log.info("Daily batch complete: {}", summary);
            } else {
                log.warn("Daily batch finished with errors (success={}): {}", success, error);
            }
            return new BatchResult(success, cycle.retrainTriggered(), ideas.get(),
                    generated.prompts.size(), generated.written, summary, error, run);
        }
    }

    // ------------------------------------------------------------------
    // Manual generation
    // ------------------------------------------------------------------

    /**
     * Learning cycle (if needed) → prompts → write-back. No idea generation.
     *
     * @throws IllegalArgumentException if numPrompts is zero or negative
     */
    public GenerateResult runManualGenerate(Integer numPrompts, String renderer, boolean forceRetrain) {
        int    promptsWanted = positiveOrDefault(numPrompts, batch.defaultNumPrompts(), "numPrompts");
        String rendererUsed  = rendererOrDefault(renderer);

        LearningCycleResult cycle = learning.runLearningCycle(forceRetrain);

        PipelineRun run = new PipelineRun(RunKind.MANUAL_GENERATE, Stages.newRunId(), clock.instant());
        try (RunLogContext ignored = RunLogContext.open(run)) {
            log.info("Starting manual generation (prompts={}, renderer={})", promptsWanted, rendererUsed);

            Generated generated = generateAndWrite(run, promptsWanted, rendererUsed);
            run.finish(clock.instant());

            String summary = summary(cycle, List.of(generated.prompts.size() + " prompts created"));
            String error   = joinErrors(run, StageName.PROMPTS);

            state.recordGeneration(summary, error);
            log.info("Manual generation complete: {}", summary);
            return new GenerateResult(error == null, cycle.retrainTriggered(),
                    generated.prompts.size(), generated.written, rendererUsed, error, run);
        }
    }

    // ------------------------------------------------------------------
    // Likes and admin
    // ------------------------------------------------------------------

    /**
     * Count a like. Reaching the threshold hands a learning cycle to the
     * background executor; the response does not wait for it.
     */
    public LikeResult recordLike(LikeEvent event) {
        int count     = state.recordLike();
        int threshold = learning.likeThreshold();
        log.info("Like received (record={}, structure={}): {}/{}",
                event.recordId(), event.structureId(), count, threshold);

        if (count >= threshold) {
            boolean dispatched = learning.dispatch(false);
            log.info("Like threshold reached, learning cycle {}", dispatched ? "dispatched" : "not dispatched");
            return new LikeResult("threshold_reached", count, threshold, true, dispatched,
                    "Threshold reached. Learning cycle triggered.");
        }

        int remaining = Math.max(0, threshold - count);
        return new LikeResult("recorded", count, threshold, false, false,
                "Like recorded. " + remaining + " until next learning cycle.");
    }

    /** Admin reset of the like counter; not a retrain. */
    public void resetCounter() {
        log.warn("Like counter reset (was {})", state.likesSinceLastRetrain());
        state.resetLikes();
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public StateSnapshot snapshot() {
        return state.snapshot();
    }

    public int likeThreshold() {
        return learning.likeThreshold();
    }

    public double explorationRate() {
        return learning.explorationRate();
    }

    public ScoreSet cachedScores() {
        return scoreCache.current();
    }

    public boolean scoresFresh(ScoreSet scores) {
        return scoreCache.isFresh(scores, scoreMaxAge);
    }

    // ------------------------------------------------------------------
    // Shared steps
    // ------------------------------------------------------------------

    private static final class Generated {
        List<GeneratedPrompt> prompts = List.of();
        int written;
    }

    private Generated generateAndWrite(PipelineRun run, int promptsWanted, String renderer) {
        Generated out = new Generated();
        generator.warmUp();
        boolean ok = Stages.run(run, StageName.PROMPTS, "Generating prompts", clock, () ->
                out.prompts = generator.generatePrompts(promptsWanted, renderer));
        if (ok) {
            Stages.run(run, StageName.WRITE_PROMPTS, "Writing prompts to persistence", clock, () ->
                    out.written = writePrompts(out.prompts));
        }
        return out;
    }

    private int writePrompts(List<GeneratedPrompt> prompts) {
        if (prompts.isEmpty()) {
            return 0;
        }
        PersistenceClient.WriteReport report = persistence.writePrompts(prompts);
        if (report.failed() > 0) {
            log.warn("{} of {} prompts were not written", report.failed(), prompts.size());
        }
        return report.written();
    }

    /** An empty set is fine: the strategist then explores without scores. */
    private ScoreSet scoresForBatch() {
        try {
            return scoreCache.getScores(scoreMaxAge);
        } catch (ServiceException e) {
            log.warn("No optimizer scores available, continuing without them: {}", e.getMessage());
            return ScoreSet.empty();
        }
    }

    private static String summary(LearningCycleResult cycle, List<String> parts) {
        List<String> all = new ArrayList<>();
        if (cycle.retrainTriggered()) {
            all.add(cycle.success()
                    ? "Learning cycle completed"
                    : "Learning cycle failed at " + cycle.failedStage());
        }
        all.addAll(parts);
        return String.join(". ", all) + ".";
    }

    /** "ideas: msg; prompts: msg", or null when none of the stages failed. */
    private static String joinErrors(PipelineRun run, StageName... stages) {
        List<String> errors = new ArrayList<>();
        for (StageName stage : stages) {
            StageOutcome outcome = run.outcome(stage);
            if (outcome.failed()) {
                errors.add(stage.wireName() + ": " + outcome.error());
            }
        }
        return errors.isEmpty() ? null : String.join("; ", errors);
    }

    private static int positiveOrDefault(Integer value, int fallback, String name) {
        requirePositive(value, name);
        return value == null ? fallback : value;
    }

    private static void requirePositive(Integer value, String name) {
        if (value != null && value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private String rendererOrDefault(String renderer) {
        return isBlank(renderer) ? batch.defaultRenderer() : renderer;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
