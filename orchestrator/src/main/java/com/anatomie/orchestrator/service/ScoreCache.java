package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.client.OptimizerClient;
import com.anatomie.orchestrator.client.ServiceException;
import com.anatomie.orchestrator.model.OrchestratorState;
import com.anatomie.orchestrator.model.ScoreSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Time-bounded, single-entry cache of optimizer scores.
 *
 * The entry itself lives in {@link OrchestratorState}; this class owns the
 * refresh policy. Concurrent callers that find the entry stale share one
 * optimizer fetch: the first takes {@link #refreshLock}, the rest wait and
 * then see the fresh entry.
 */
@Service
public class ScoreCache {

    private static final Logger log = LoggerFactory.getLogger(ScoreCache.class);

    private final OrchestratorState state;
    private final OptimizerClient   optimizer;
    private final Clock             clock;
    private final ReentrantLock     refreshLock = new ReentrantLock();

    public ScoreCache(OrchestratorState state, OptimizerClient optimizer, Clock clock) {
        this.state     = state;
        this.optimizer = optimizer;
        this.clock     = clock;
    }

    /**
     * Return the cached scores if fetched within {@code maxAge}, otherwise
     * fetch, store and return fresh ones.
     *
     * @throws ServiceException if the fetch fails and nothing is cached
     */
    public ScoreSet getScores(Duration maxAge) {
        ScoreSet cached = state.cachedScores();
        if (cached.isFreshAt(clock.instant(), maxAge)) {
            return cached;
        }

        refreshLock.lock();
        try {
            // Another caller may have refreshed while we waited.
            cached = state.cachedScores();
            if (cached.isFreshAt(clock.instant(), maxAge)) {
                return cached;
            }

            log.info("Score cache stale or empty, fetching from optimizer");
            try {
                ScoreSet fresh = ScoreSet.fromStructures(optimizer.scoreStructures(), clock.instant());
                state.cacheScores(fresh);
                log.info("Cached {} structure scores", fresh.size());
                return fresh;
            } catch (ServiceException e) {
                if (cached.fetchedAt() == null) {
                    throw e;
                }
                log.warn("Score refresh failed, serving stale cache from {}: {}",
                        cached.fetchedAt(), e.getMessage());
                return cached;
            }
        } finally {
            refreshLock.unlock();
        }
    }

    /** Overwrite the cache, e.g. with the scores of a finished learning cycle. */
    public void setScores(ScoreSet scores) {
        state.cacheScores(scores);
    }

    /** The cached entry as is, without refreshing. */
    public ScoreSet current() {
        return state.cachedScores();
    }

    public boolean isFresh(ScoreSet scores, Duration maxAge) {
        return scores.isFreshAt(clock.instant(), maxAge);
    }
}
