package com.anatomie.orchestrator.model;

import com.anatomie.orchestrator.client.dto.ScoreStructuresResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity id → predicted-success score in [0, 1], stamped with the time it
 * was fetched from the optimizer. Immutable.
 *
 * The optimizer is the source of truth; we only cache and forward this.
 */
public record ScoreSet(Map<String, Double> scores, Instant fetchedAt) {

    private static final Logger log = LoggerFactory.getLogger(ScoreSet.class);

    private static final ScoreSet EMPTY = new ScoreSet(Map.of(), null);

    public ScoreSet {
        scores = scores == null ? Map.of() : Map.copyOf(scores);
    }

    public static ScoreSet empty() {
        return EMPTY;
    }

    /**
     * Build a ScoreSet from the optimizer's structures list.
     * Null entries, entries without an id or a score, and scores outside
     * [0, 1] are dropped.
     */
    public static ScoreSet fromStructures(ScoreStructuresResponse response, Instant fetchedAt) {
        Map<String, Double> scores = new LinkedHashMap<>();
        int dropped = 0;
        for (ScoreStructuresResponse.StructureScore s : response.structures()) {
            if (s == null) {
                dropped++;
                continue;
            }
            Double score = s.predicted_success_score();
            if (s.structure_id() == null || s.structure_id().isBlank()
                    || score == null || score.isNaN() || score < 0.0 || score > 1.0) {
                dropped++;
                continue;
            }
            scores.put(s.structure_id(), score);
        }
        if (dropped > 0) {
            log.warn("Dropped {} malformed structure scores from optimizer response", dropped);
        }
        return new ScoreSet(scores, fetchedAt);
    }

    public boolean isEmpty() { return scores.isEmpty(); }
    public int     size()    { return scores.size(); }

    /** True when fetched no longer than {@code maxAge} before {@code now}. */
    public boolean isFreshAt(Instant now, Duration maxAge) {
        return fetchedAt != null && Duration.between(fetchedAt, now).compareTo(maxAge) <= 0;
    }
}
