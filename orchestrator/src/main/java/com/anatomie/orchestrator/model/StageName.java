package com.anatomie.orchestrator.model;

/**
 * Every stage a pipeline can contain. {@link RunKind} decides which ones a
 * given workflow runs and in what order.
 */
public enum StageName {
    // Learning cycle, strictly sequential
    TRAIN("train"),                           // optimizer retrains on the latest feedback
    SCORE("score"),                           // optimizer scores every structure
    INSIGHTS("insights"),                     // optimizer explains scores per structure
    UPDATE_PREFERENCES("update_preferences"), // generator receives scores + insights
    PERSIST_SCORES("persist_scores"),         // one score write per structure

    // Generation batches, independent of each other
    IDEAS("ideas"),                           // strategist proposes new structures
    PROMPTS("prompts"),                       // generator writes prompts
    WRITE_PROMPTS("write_prompts");           // prompts copied to the persistence backend

    private final String wireName;

    StageName(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in API responses (failedStage) and logs. */
    public String wireName() {
        return wireName;
    }
}
