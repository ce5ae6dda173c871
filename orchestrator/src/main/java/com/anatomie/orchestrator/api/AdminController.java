package com.anatomie.orchestrator.api;

import com.anatomie.orchestrator.api.dto.TriggerResponse;
import com.anatomie.orchestrator.service.BatchWorkflowCoordinator;
import com.anatomie.orchestrator.service.LearningCycleCoordinator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin operations.
 *
 * POST /trigger_retrain  : start a forced learning cycle in the background
 * POST /reset_counter    : zero the like counter without retraining
 */
@RestController
public class AdminController {

    private final LearningCycleCoordinator learning;
    private final BatchWorkflowCoordinator batches;

    public AdminController(LearningCycleCoordinator learning, BatchWorkflowCoordinator batches) {
        this.learning = learning;
        this.batches  = batches;
    }

    /** Returns already_running (HTTP 200) instead of queueing a second cycle. */
    @PostMapping("/trigger_retrain")
    public TriggerResponse triggerRetrain() {
        return learning.triggerAsync() ? TriggerResponse.triggered() : TriggerResponse.alreadyRunning();
    }

    @PostMapping("/reset_counter")
    public TriggerResponse resetCounter() {
        batches.resetCounter();
        return TriggerResponse.reset();
    }
}
