package com.anatomie.orchestrator.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Application-wide beans that are not tied to a single component.
 */
@Configuration
@EnableConfigurationProperties(OrchestratorProperties.class)
public class OrchestratorConfig {

    /** Injected wherever "now" matters so tests can move time. */
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs learning cycles that were triggered by a like or by
     * POST /trigger_retrain, so those requests return immediately.
     *
     * One core thread is enough: cycles are single-flight anyway, and extra
     * triggers simply join the running cycle. On shutdown we wait for the
     * running cycle so its state commit is not cut off halfway.
     */
    @Bean(name = "learningCycleExecutor")
    ThreadPoolTaskExecutor learningCycleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("learning-cycle-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(660);
        return executor;
    }
}
