package com.anatomie.orchestrator.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** Response from POST /generate-prompts. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratePromptsResponse(List<GeneratedPrompt> prompts) {
    public GeneratePromptsResponse {
        if (prompts == null) prompts = List.of();
    }
}
