package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.client.dto.GeneratePromptsRequest;
import com.anatomie.orchestrator.client.dto.GeneratePromptsResponse;
import com.anatomie.orchestrator.client.dto.GeneratedPrompt;
import com.anatomie.orchestrator.client.dto.UpdatePreferencesRequest;
import com.anatomie.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the prompt generator.
 *
 * Large prompt requests are split into chunks of {@code generatorBatchSize}
 * with a pause between chunks; one big request tends to hit the generator's
 * own timeout and rate limits.
 */
@Component
public class GeneratorClient {

    private static final Logger log = LoggerFactory.getLogger(GeneratorClient.class);

    static final String SERVICE = "generator";

    private final JsonHttpTransport http;
    private final ServiceCaller     caller;
    private final String            baseUrl;
    private final ServiceCallPolicy updatePolicy;
    private final ServiceCallPolicy generatePolicy;
    private final Duration          warmUpTimeout;
    private final int               chunkSize;
    private final Duration          chunkDelay;

    public GeneratorClient(OrchestratorProperties properties,
                           JsonHttpTransport http,
                           ServiceCaller caller) {
        this.http           = http;
        this.caller         = caller;
        this.baseUrl        = properties.services().generatorUrl();
        this.updatePolicy   = new ServiceCallPolicy(properties.timeouts().update(),
                                                    properties.retry().maxAttempts());
        this.generatePolicy = ServiceCallPolicy.creating(properties.timeouts().generator(),
                                                         properties.retry().maxAttempts());
        this.warmUpTimeout  = properties.timeouts().warmUp();
        this.chunkSize      = properties.batch().generatorBatchSize();
        this.chunkDelay     = properties.batch().generatorBatchDelay();
    }

    /** Push fresh scores and insights to the generator (POST /update_preferences). */
    public void updatePreferences(UpdatePreferencesRequest request) {
        log.info("Updating generator preferences: {} structure scores, {} insights",
                request.structure_scores().size(), request.structure_prompt_insights().size());
        caller.execute(SERVICE, "update_preferences", updatePolicy, () ->
                http.post(baseUrl + "/update_preferences", request, updatePolicy.timeout(),
                          "generator update_preferences"));
    }

    /**
     * Generate {@code numPrompts} prompts for {@code renderer}
     * (POST /generate-prompts, chunked).
     *
     * @throws ServiceException if any chunk fails; prompts from earlier chunks are dropped
     */
    public List<GeneratedPrompt> generatePrompts(int numPrompts, String renderer) {
        List<GeneratedPrompt> all = new ArrayList<>();
        int remaining = numPrompts;
        int chunk     = 0;

        while (remaining > 0) {
            chunk++;
            int size = Math.min(remaining, chunkSize);
            log.info("Generator chunk {}: requesting {} prompts", chunk, size);

            GeneratePromptsRequest req = new GeneratePromptsRequest(size, renderer);
            String body = caller.execute(SERVICE, "generate_prompts", generatePolicy, () ->
                    http.post(baseUrl + "/generate-prompts", req, generatePolicy.timeout(),
                              "generator generate-prompts"));
            List<GeneratedPrompt> received =
                    http.read(body, GeneratePromptsResponse.class, "generator generate-prompts").prompts();
            all.addAll(received);
            log.info("Generator chunk {}: received {} prompts", chunk, received.size());

            remaining -= size;
            if (remaining > 0) {
                pause();
            }
        }

        log.info("Generator complete: {} prompts from {} chunks", all.size(), chunk);
        return all;
    }

    public boolean warmUp() {
        return WarmUp.ping(http, SERVICE, baseUrl + "/health", warmUpTimeout);
    }

    private void pause() {
        if (chunkDelay.isZero() || chunkDelay.isNegative()) return;
        try {
            Thread.sleep(chunkDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceException(ServiceException.Kind.TRANSIENT,
                    "Prompt generation interrupted between chunks", e);
        }
    }
}
