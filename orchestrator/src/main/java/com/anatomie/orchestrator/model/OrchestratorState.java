package com.anatomie.orchestrator.model;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide counters, timestamps and the cached ScoreSet.
 *
 * One instance per process, created empty at startup and injected into both
 * coordinators. Every read and write goes through {@link #lock}, and each
 * method is one complete update, so concurrent likes never lose increments
 * and readers never see a half-applied cycle commit.
 *
 * The lock is only ever held for in-memory work, never across a network call.
 *
 * Invariants:
 *   0 ≤ likesSinceLastRetrain ≤ totalLikesProcessed
 *   totalRetrains, totalLikesProcessed, totalBatches, totalGenerations never decrease
 */
@Component
public class OrchestratorState {

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock         clock;

    // Learning cycle
    private int     likesSinceLastRetrain = 0;
    private Instant lastRetrainAt;
    private Instant lastLikeAt;
    private int     totalRetrains = 0;
    private long    totalLikesProcessed = 0;
    private boolean retraining = false;
    private String  lastError;

    // Daily batch
    private Instant lastBatchAt;
    private int     totalBatches = 0;
    private String  lastBatchSummary;

    // Manual generation
    private Instant lastGenerationAt;
    private int     totalGenerations = 0;
    private String  lastGenerationSummary;

    // Score cache (single entry)
    private ScoreSet cachedScores = ScoreSet.empty();

    public OrchestratorState(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Likes
    // ------------------------------------------------------------------

    /** Count one like. Returns likesSinceLastRetrain after the increment. */
    public int recordLike() {
        lock.lock();
        try {
            likesSinceLastRetrain++;
            totalLikesProcessed++;
            lastLikeAt = clock.instant();
            return likesSinceLastRetrain;
        } finally {
            lock.unlock();
        }
    }

    public int likesSinceLastRetrain() {
        lock.lock();
        try {
            return likesSinceLastRetrain;
        } finally {
            lock.unlock();
        }
    }

    /** Admin reset (POST /reset_counter). Does not count as a retrain. */
    public void resetLikes() {
        lock.lock();
        try {
            likesSinceLastRetrain = 0;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Learning cycle
    // ------------------------------------------------------------------

    /**
     * Mark a cycle as started and return the like count it will consume if
     * training succeeds. Likes arriving while the cycle runs are kept for
     * the next one.
     */
    public int beginCycle() {
        lock.lock();
        try {
            retraining = true;
            return likesSinceLastRetrain;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the outcome of a finished cycle in one step.
     *
     * Training is the commit point: only a successful train consumes the
     * likes, stamps lastRetrainAt and bumps totalRetrains. A fresh ScoreSet
     * replaces the cache whenever the score stage produced one, whatever
     * happened afterwards.
     */
    public void commitCycle(CycleCommit commit) {
        lock.lock();
        try {
            if (commit.trained()) {
                likesSinceLastRetrain = Math.max(0, likesSinceLastRetrain - commit.likesConsumed());
                lastRetrainAt = clock.instant();
                totalRetrains++;
            }
            if (commit.scores() != null) {
                cachedScores = commit.scores();
            }
            lastError  = commit.error();
            retraining = false;
        } finally {
            lock.unlock();
        }
    }

    public boolean isRetraining() {
        lock.lock();
        try {
            return retraining;
        } finally {
            lock.unlock();
        }
    }

    /**
     * What a finished learning cycle hands back to the state.
     *
     * @param trained        true when the train stage succeeded
     * @param likesConsumed  value returned by {@link #beginCycle()}
     * @param scores         fresh scores, or null when the score stage did not succeed
     * @param error          failure message, or null on full success
     */
    public record CycleCommit(boolean trained, int likesConsumed, ScoreSet scores, String error) {}

    // ------------------------------------------------------------------
    // Batches and generations
    // ------------------------------------------------------------------

    /** Count a daily batch attempt, successful or not. */
    public void recordBatch(String summary, String error) {
        lock.lock();
        try {
            lastBatchAt      = clock.instant();
            totalBatches++;
            lastBatchSummary = summary;
            if (error != null) lastError = error;
        } finally {
            lock.unlock();
        }
    }

    /** Count a manual generation attempt, successful or not. */
    public void recordGeneration(String summary, String error) {
        lock.lock();
        try {
            lastGenerationAt      = clock.instant();
            totalGenerations++;
            lastGenerationSummary = summary;
            if (error != null) lastError = error;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Score cache storage (policy lives in ScoreCache)
    // ------------------------------------------------------------------

    public ScoreSet cachedScores() {
        lock.lock();
        try {
            return cachedScores;
        } finally {
            lock.unlock();
        }
    }

    public void cacheScores(ScoreSet scores) {
        lock.lock();
        try {
            cachedScores = scores == null ? ScoreSet.empty() : scores;
        } finally {
            lock.unlock();
        }
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public StateSnapshot snapshot() {
        lock.lock();
        try {
            return new StateSnapshot(
                    likesSinceLastRetrain,
                    lastRetrainAt,
                    lastLikeAt,
                    totalRetrains,
                    totalLikesProcessed,
                    retraining,
                    lastError,
                    lastBatchAt,
                    totalBatches,
                    lastBatchSummary,
                    lastGenerationAt,
                    totalGenerations,
                    lastGenerationSummary,
                    cachedScores.fetchedAt(),
                    cachedScores.size());
        } finally {
            lock.unlock();
        }
    }
}
