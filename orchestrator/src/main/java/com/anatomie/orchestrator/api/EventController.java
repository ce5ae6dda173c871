package com.anatomie.orchestrator.api;

import com.anatomie.orchestrator.api.dto.DailyBatchRequest;
import com.anatomie.orchestrator.api.dto.DailyBatchResponse;
import com.anatomie.orchestrator.api.dto.LikeEventRequest;
import com.anatomie.orchestrator.api.dto.LikeEventResponse;
import com.anatomie.orchestrator.api.dto.ManualGenerateRequest;
import com.anatomie.orchestrator.api.dto.ManualGenerateResponse;
import com.anatomie.orchestrator.service.BatchWorkflowCoordinator;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound events from the workflow automation (n8n).
 *
 * POST /events/like             : count a like, maybe start a learning cycle
 * POST /like_event              : legacy alias of /events/like
 * POST /events/daily_batch      : scheduled batch: cycle, ideas, prompts
 * POST /events/manual_generate  : prompts on demand
 *
 * The batch endpoints block until the workflow is done; stage failures come
 * back as success=false with HTTP 200.
 */
@RestController
public class EventController {

    private final BatchWorkflowCoordinator coordinator;

    public EventController(BatchWorkflowCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/events/like \
     *     -H "Content-Type: application/json" \
     *     -d '{"recordId":"rec123","structureId":"struct-7"}'
     */
    @PostMapping({"/events/like", "/like_event"})
    public LikeEventResponse like(@RequestBody(required = false) LikeEventRequest req) {
        LikeEventRequest body = req != null ? req : new LikeEventRequest(null, null, null);
        return LikeEventResponse.from(coordinator.recordLike(body.toEvent()));
    }

    @PostMapping("/events/daily_batch")
    public DailyBatchResponse dailyBatch(@RequestBody(required = false) DailyBatchRequest req) {
        DailyBatchRequest body = req != null ? req : DailyBatchRequest.defaults();
        return DailyBatchResponse.from(coordinator.runDailyBatch(
                body.forced(), body.numIdeas(), body.numPrompts(), body.renderer()));
    }

    @PostMapping("/events/manual_generate")
    public ManualGenerateResponse manualGenerate(@RequestBody(required = false) ManualGenerateRequest req) {
        ManualGenerateRequest body = req != null ? req : ManualGenerateRequest.defaults();
        return ManualGenerateResponse.from(coordinator.runManualGenerate(
                body.numPrompts(), body.renderer(), body.forced()));
    }
}
