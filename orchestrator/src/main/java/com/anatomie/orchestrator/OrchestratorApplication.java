package com.anatomie.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Anatomie orchestrator: counts likes, runs learning cycles against the
 * optimizer, and drives the daily / manual prompt generation batches.
 *
 * To run:
 *   OPTIMIZER_SERVICE_URL=http://localhost:8001 mvn -pl orchestrator spring-boot:run
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}
