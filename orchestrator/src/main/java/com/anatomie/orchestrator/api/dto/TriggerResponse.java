package com.anatomie.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response body for the admin endpoints.
 *
 * status: "triggered" | "already_running" | "reset"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerResponse(String status, String message, Integer likesSinceLastRetrain) {

    public static TriggerResponse triggered() {
        return new TriggerResponse("triggered", "Learning cycle started in background", null);
    }

    public static TriggerResponse alreadyRunning() {
        return new TriggerResponse("already_running", "A learning cycle is already running", null);
    }

    public static TriggerResponse reset() {
        return new TriggerResponse("reset", "Like counter reset", 0);
    }
}
