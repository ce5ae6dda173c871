package com.anatomie.orchestrator.api.dto;

import java.time.Instant;
import java.util.Map;

/** Response body for GET /scores. cachedAt is null until the first fetch. */
public record ScoresResponse(
        Map<String, Double> scores,
        Instant             cachedAt,
        boolean             fresh,
        int                 count
) {}
