package com.anatomie.orchestrator.client;

import com.anatomie.orchestrator.config.OrchestratorProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Retry + metrics wrapper around every outbound collaborator call.
 *
 * Retries only {@link ServiceException}s of kind TRANSIENT, with exponential
 * backoff, up to {@link ServiceCallPolicy#maxAttempts()}. Non-idempotent
 * calls are narrower still, see {@link ServiceCallPolicy}. Coordinators never
 * see the retries, only the added latency or the final exception.
 *
 * Every call is timed and counted:
 * <pre>
 *   anatomie.service.calls{service, operation, status="success|transient|collaborator|parse|error"}
 *   anatomie.service.duration{service, operation}
 * </pre>
 */
@Component
public class ServiceCaller {

    private static final Logger log = LoggerFactory.getLogger(ServiceCaller.class);

    private final MeterRegistry meterRegistry;
    private final Duration      initialBackoff;
    private final double        multiplier;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();

    @Autowired
    public ServiceCaller(OrchestratorProperties properties, MeterRegistry meterRegistry) {
        this(properties.retry().initialBackoff(), properties.retry().multiplier(), meterRegistry);
    }

    public ServiceCaller(Duration initialBackoff, double multiplier, MeterRegistry meterRegistry) {
        this.initialBackoff = initialBackoff;
        this.multiplier     = multiplier;
        this.meterRegistry  = meterRegistry;
    }

    /**
     * Run {@code call} under the retry policy.
     *
     * @throws ServiceException the last failure once attempts are exhausted,
     *                          or the first non-retryable one
     */
    public <T> T execute(String service, String operation, ServiceCallPolicy policy, Supplier<T> call) {
        Retry retry = retries.computeIfAbsent(
                service + "." + operation + "#" + policy.maxAttempts() + (policy.idempotent() ? "" : "!"),
                name -> newRetry(name, policy));

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            return Retry.decorateSupplier(retry, call).get();
        } catch (ServiceException e) {
            status = e.getKind().name().toLowerCase();
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("anatomie.service.duration",
                    "service", service, "operation", operation));
            meterRegistry.counter("anatomie.service.calls",
                    "service", service, "operation", operation, "status", status).increment();
        }
    }

    private Retry newRetry(String name, ServiceCallPolicy policy) {
        int maxAttempts = policy.maxAttempts();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier))
                .retryOnException(e -> e instanceof ServiceException se && policy.mayRetry(se))
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying {} (attempt {}/{}) after {}: {}",
                        name, event.getNumberOfRetryAttempts() + 1, maxAttempts,
                        event.getWaitInterval(),
                        event.getLastThrowable() == null ? "?" : event.getLastThrowable().getMessage()));
        return retry;
    }
}
