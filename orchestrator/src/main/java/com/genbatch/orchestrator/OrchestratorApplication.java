package com.genbatch.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Batch generation orchestrator.
 *
 * Runs one batch and exits; the exit code comes from
 * {@link com.genbatch.orchestrator.service.BatchRunner}.
 */
@SpringBootApplication
public class OrchestratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(OrchestratorApplication.class, args)));
    }
}
