package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One prompt produced by the generator. The id fields are record ids in the
 * persistence backend and become linked-record fields when the prompt is
 * written back.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedPrompt(
        String promptText,
        String renderer,
        String designerId,
        String garmentId,
        String promptStructureId
) {}
