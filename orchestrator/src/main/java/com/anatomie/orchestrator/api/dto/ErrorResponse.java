package com.anatomie.orchestrator.api.dto;

/** Body of every error response. success is always false. */
public record ErrorResponse(boolean success, String error) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(false, error);
    }
}
