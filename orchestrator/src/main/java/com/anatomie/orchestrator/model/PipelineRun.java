package com.anatomie.orchestrator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One execution of a workflow: its stages in plan order, each PENDING until
 * recorded as OK or FAILED.
 *
 * A run lives only as long as the call that produced it. It is mutated by a
 * single thread; other threads only read it after the run has finished.
 */
public class PipelineRun {

    private final RunKind kind;
    private final String  runId;
    private final Instant startedAt;

    // Plan order is preserved by LinkedHashMap.
    private final Map<StageName, StageOutcome> stages = new LinkedHashMap<>();

    private Instant finishedAt;
    private boolean overallSuccess;

    public PipelineRun(RunKind kind, String runId, Instant startedAt) {
        this.kind      = kind;
        this.runId     = runId;
        this.startedAt = startedAt;
        for (StageName stage : kind.plan()) {
            stages.put(stage, StageOutcome.pending(stage));
        }
    }

    // ------------------------------------------------------------------
    // Recording
    // ------------------------------------------------------------------

    public void succeed(StageName stage, Instant started, Instant finished) {
        record(new StageOutcome(stage, StageStatus.OK, null, started, finished));
    }

    public void fail(StageName stage, String error, Instant started, Instant finished) {
        record(new StageOutcome(stage, StageStatus.FAILED, error, started, finished));
    }

    /** Close the run. Successful only if every planned stage is OK. */
    public void finish(Instant at) {
        this.finishedAt     = at;
        this.overallSuccess = stages.values().stream().allMatch(StageOutcome::ok);
    }

    private void record(StageOutcome outcome) {
        if (!stages.containsKey(outcome.stage())) {
            throw new IllegalArgumentException(
                    "Stage " + outcome.stage() + " is not part of a " + kind + " run");
        }
        stages.put(outcome.stage(), outcome);
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public StageOutcome outcome(StageName stage) {
        StageOutcome o = stages.get(stage);
        if (o == null) {
            throw new IllegalArgumentException("Stage " + stage + " is not part of a " + kind + " run");
        }
        return o;
    }

    /** The earliest failed stage in plan order, if any. */
    public Optional<StageOutcome> firstFailure() {
        return stages.values().stream().filter(StageOutcome::failed).findFirst();
    }

    /** 1-based position in the plan, for "Step 2/5" log lines. */
    public int positionOf(StageName stage) {
        return kind.plan().indexOf(stage) + 1;
    }

    public int stageCount() {
        return kind.plan().size();
    }

    public RunKind            getKind()           { return kind; }
    public String             getRunId()          { return runId; }
    public Instant            getStartedAt()      { return startedAt; }
    public Instant            getFinishedAt()     { return finishedAt; }
    public boolean            isOverallSuccess()  { return overallSuccess; }
    public List<StageOutcome> getStages()         { return new ArrayList<>(stages.values()); }
}
