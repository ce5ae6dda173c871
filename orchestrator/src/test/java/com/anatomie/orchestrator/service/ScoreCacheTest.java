package com.anatomie.orchestrator.service;

import com.anatomie.orchestrator.MutableClock;
import com.anatomie.orchestrator.client.OptimizerClient;
import com.anatomie.orchestrator.client.ServiceException;
import com.anatomie.orchestrator.client.dto.ScoreStructuresResponse;
import com.anatomie.orchestrator.client.dto.ScoreStructuresResponse.StructureScore;
import com.anatomie.orchestrator.model.OrchestratorState;
import com.anatomie.orchestrator.model.ScoreSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * Refresh policy of ScoreCache. The optimizer is mocked; time is moved by
 * hand through MutableClock.
 */
@ExtendWith(MockitoExtension.class)
class ScoreCacheTest {

    static final Instant  T0      = Instant.parse("2026-03-01T06:00:00Z");
    static final Duration MAX_AGE = Duration.ofHours(24);

    @Mock OptimizerClient optimizer;

    MutableClock      clock;
    OrchestratorState state;
    ScoreCache        cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        state = new OrchestratorState(clock);
        cache = new ScoreCache(state, optimizer, clock);
    }

    @Test
    void getScores_emptyCache_fetchesAndStores() {
        when(optimizer.scoreStructures()).thenReturn(response("s1", 0.9));

        ScoreSet scores = cache.getScores(MAX_AGE);

        assertThat(scores.scores()).containsEntry("s1", 0.9);
        assertThat(scores.fetchedAt()).isEqualTo(T0);
        assertThat(state.cachedScores()).isEqualTo(scores);
    }

    @Test
    void getScores_freshCache_noFetch() {
        state.cacheScores(new ScoreSet(Map.of("s1", 0.4), T0));
        clock.advance(Duration.ofHours(23));

        ScoreSet scores = cache.getScores(MAX_AGE);

        assertThat(scores.scores()).containsEntry("s1", 0.4);
        verifyNoInteractions(optimizer);
    }

    @Test
    void getScores_staleCache_refetches() {
        state.cacheScores(new ScoreSet(Map.of("s1", 0.4), T0));
        clock.advance(Duration.ofHours(25));
        when(optimizer.scoreStructures()).thenReturn(response("s1", 0.6));

        ScoreSet scores = cache.getScores(MAX_AGE);

        assertThat(scores.scores()).containsEntry("s1", 0.6);
        assertThat(scores.fetchedAt()).isEqualTo(T0.plus(Duration.ofHours(25)));
    }

    @Test
    void getScores_fetchFailsWithStaleCache_servesStale() {
        ScoreSet stale = new ScoreSet(Map.of("s1", 0.4), T0);
        state.cacheScores(stale);
        clock.advance(Duration.ofDays(2));
        when(optimizer.scoreStructures())
                .thenThrow(new ServiceException(ServiceException.Kind.TRANSIENT, "HTTP 503"));

        assertThat(cache.getScores(MAX_AGE)).isEqualTo(stale);
    }

    @Test
    void getScores_fetchFailsWithEmptyCache_throws() {
        when(optimizer.scoreStructures())
                .thenThrow(new ServiceException(ServiceException.Kind.TRANSIENT, "HTTP 503"));

        assertThatThrownBy(() -> cache.getScores(MAX_AGE))
                .isInstanceOf(ServiceException.class)
                .hasMessageContaining("503");
    }

    @Test
    void getScores_concurrentStaleCallers_shareOneFetch() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch release      = new CountDownLatch(1);
        when(optimizer.scoreStructures()).thenAnswer(inv -> {
            fetchStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            return response("s1", 0.7);
        });

        AtomicReference<ScoreSet> first  = new AtomicReference<>();
        AtomicReference<ScoreSet> second = new AtomicReference<>();
        Thread a = new Thread(() -> first.set(cache.getScores(MAX_AGE)));
        Thread b = new Thread(() -> second.set(cache.getScores(MAX_AGE)));

        a.start();
        assertThat(fetchStarted.await(5, TimeUnit.SECONDS)).isTrue();
        b.start();
        awaitParked(b);
        release.countDown();
        a.join(5000);
        b.join(5000);

        verify(optimizer, times(1)).scoreStructures();
        assertThat(first.get()).isEqualTo(second.get());
    }

    @Test
    void setScores_overwritesUnconditionally() {
        ScoreSet scores = new ScoreSet(Map.of("s9", 0.1), T0);

        cache.setScores(scores);

        assertThat(cache.current()).isEqualTo(scores);
        assertThat(cache.isFresh(scores, MAX_AGE)).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static ScoreStructuresResponse response(String id, double score) {
        return new ScoreStructuresResponse(List.of(new StructureScore(id, score)), Map.of());
    }

    /** Wait until the thread blocks on a lock or future. */
    static void awaitParked(Thread t) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (t.getState() != Thread.State.WAITING && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertThat(t.getState()).isEqualTo(Thread.State.WAITING);
    }
}
