package com.anatomie.orchestrator.api.dto;

import com.anatomie.orchestrator.model.LikeEvent;
import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Request body for POST /events/like and POST /like_event.
 * All fields optional; the snake_case aliases keep older callers working.
 */
public record LikeEventRequest(
        @JsonAlias("record_id")    String recordId,
        @JsonAlias("structure_id") String structureId,
        @JsonAlias("image_url")    String imageUrl
) {
    public LikeEvent toEvent() {
        return new LikeEvent(recordId, structureId, imageUrl);
    }
}
