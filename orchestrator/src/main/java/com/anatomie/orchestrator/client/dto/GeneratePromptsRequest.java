package com.anatomie.orchestrator.client.dto;

/** Request body for POST /generate-prompts on the generator. */
public record GeneratePromptsRequest(int num_prompts, String renderer) {}
