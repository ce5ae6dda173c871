package com.anatomie.orchestrator.api.dto;

import com.anatomie.orchestrator.model.StateSnapshot;

/**
 * Response body for GET /status: service identity, the tunables that drive
 * the learning cycle, and a consistent snapshot of the counters.
 */
public record StatusResponse(
        String        service,
        String        version,
        int           threshold,
        double        explorationRate,
        StateSnapshot state
) {}
