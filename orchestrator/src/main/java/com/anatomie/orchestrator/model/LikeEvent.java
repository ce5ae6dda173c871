package com.anatomie.orchestrator.model;

/**
 * A "like" on a generated image. Only counted; the ids are logged for
 * tracing and then discarded. All fields are optional.
 */
public record LikeEvent(String recordId, String structureId, String imageUrl) {}
