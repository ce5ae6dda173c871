package com.anatomie.orchestrator.model;

import java.util.List;

/** The workflows the orchestrator runs, each with its fixed stage plan. */
public enum RunKind {
    LEARNING_CYCLE(List.of(
            StageName.TRAIN,
            StageName.SCORE,
            StageName.INSIGHTS,
            StageName.UPDATE_PREFERENCES,
            StageName.PERSIST_SCORES)),
    DAILY_BATCH(List.of(
            StageName.IDEAS,
            StageName.PROMPTS,
            StageName.WRITE_PROMPTS)),
    MANUAL_GENERATE(List.of(
            StageName.PROMPTS,
            StageName.WRITE_PROMPTS));

    private final List<StageName> plan;

    RunKind(List<StageName> plan) {
        this.plan = plan;
    }

    public List<StageName> plan() {
        return plan;
    }
}
