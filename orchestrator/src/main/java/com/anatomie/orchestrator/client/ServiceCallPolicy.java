package com.anatomie.orchestrator.client;

import java.time.Duration;

/**
 * Per-operation call budget: how long one HTTP attempt may take, how many
 * attempts {@link ServiceCaller} makes for transient failures, and whether
 * the call may be repeated after an ambiguous failure.
 *
 * A non-idempotent call (one that creates records, prompts or ideas) is only
 * retried when {@link ServiceException#isSafeToRepeat()} says the first
 * attempt never reached the collaborator.
 */
public record ServiceCallPolicy(Duration timeout, int maxAttempts, boolean idempotent) {

    public ServiceCallPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
    }

    public ServiceCallPolicy(Duration timeout, int maxAttempts) {
        this(timeout, maxAttempts, true);
    }

    /** Exactly one attempt: for long non-idempotent calls such as optimizer training. */
    public static ServiceCallPolicy once(Duration timeout) {
        return new ServiceCallPolicy(timeout, 1, false);
    }

    /** Calls that create something on the collaborator's side. */
    public static ServiceCallPolicy creating(Duration timeout, int maxAttempts) {
        return new ServiceCallPolicy(timeout, maxAttempts, false);
    }

    boolean mayRetry(ServiceException e) {
        return e.isRetryable() && (idempotent || e.isSafeToRepeat());
    }
}
