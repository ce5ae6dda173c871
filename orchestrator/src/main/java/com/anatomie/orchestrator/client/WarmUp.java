package com.anatomie.orchestrator.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Pre-warms a collaborator by hitting its health endpoint, so the first real
 * call does not pay a free-tier cold start inside its own timeout.
 * Never throws; a failed warm-up only produces a warning.
 */
final class WarmUp {

    private static final Logger log = LoggerFactory.getLogger(WarmUp.class);

    private WarmUp() {}

    static boolean ping(JsonHttpTransport http, String service, String healthUrl, Duration timeout) {
        log.info("Warming up {}...", service);
        try {
            int status = http.ping(healthUrl, timeout);
            if (status == 200) {
                log.info("{} is warm and ready", service);
                return true;
            }
            log.warn("{} health check returned {}", service, status);
            return false;
        } catch (ServiceException e) {
            log.warn("Could not warm up {}: {}", service, e.getMessage());
            return false;
        }
    }
}
