package com.anatomie.orchestrator.model;

/**
 * Outcome of one pipeline stage.
 *
 * Transitions:
 *   PENDING → OK      (collaborator answered)
 *   PENDING → FAILED  (collaborator failed; later stages stay PENDING)
 */
public enum StageStatus {
    PENDING,
    OK,
    FAILED
}
