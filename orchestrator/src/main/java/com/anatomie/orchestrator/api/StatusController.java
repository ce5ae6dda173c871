package com.anatomie.orchestrator.api;

import com.anatomie.orchestrator.api.dto.HealthResponse;
import com.anatomie.orchestrator.api.dto.ScoresResponse;
import com.anatomie.orchestrator.api.dto.StatusResponse;
import com.anatomie.orchestrator.model.ScoreSet;
import com.anatomie.orchestrator.model.StateSnapshot;
import com.anatomie.orchestrator.service.BatchWorkflowCoordinator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only introspection. None of these endpoints call a collaborator.
 *
 * GET /         : service banner
 * GET /health   : brief state
 * GET /status   : full snapshot plus tunables
 * GET /scores   : cached optimizer scores, no refresh
 */
@RestController
public class StatusController {

    static final String SERVICE = "anatomie-orchestrator";
    static final String VERSION = "2.0.0";

    private final BatchWorkflowCoordinator coordinator;

    public StatusController(BatchWorkflowCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/")
    public Map<String, String> root() {
        Map<String, String> banner = new LinkedHashMap<>();
        banner.put("service", SERVICE);
        banner.put("version", VERSION);
        banner.put("status",  "running");
        return banner;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        StateSnapshot s = coordinator.snapshot();
        return new HealthResponse("healthy",
                s.likesSinceLastRetrain(),
                coordinator.likeThreshold(),
                s.retraining(),
                s.totalBatches(),
                s.totalGenerations());
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return new StatusResponse(SERVICE, VERSION,
                coordinator.likeThreshold(),
                coordinator.explorationRate(),
                coordinator.snapshot());
    }

    @GetMapping("/scores")
    public ScoresResponse scores() {
        ScoreSet cached = coordinator.cachedScores();
        return new ScoresResponse(cached.scores(), cached.fetchedAt(),
                coordinator.scoresFresh(cached), cached.size());
    }
}
