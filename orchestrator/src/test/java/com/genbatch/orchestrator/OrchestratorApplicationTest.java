package com.genbatch.orchestrator;

import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.job.JobPlan;
import com.genbatch.orchestrator.job.JobPlanner;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.service.BatchRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the full context in dry-run mode: configuration binding, bean wiring
 * and the runner's planning pass, with no worker provisioned.
 */
@SpringBootTest
class OrchestratorApplicationTest {

    @DynamicPropertySource
    static void batchDirectories(DynamicPropertyRegistry registry) {
        Path root;
        try {
            root = Files.createTempDirectory("genbatch-it");
            Path alice = Files.createDirectories(root.resolve("batch").resolve("alice"));
            Files.write(alice.resolve("clothed.png"), new byte[]{1});
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        registry.add("genbatch.batch-dir", () -> root.resolve("batch").toString());
        registry.add("genbatch.output-dir", () -> root.resolve("out").toString());
        registry.add("genbatch.dry-run", () -> "true");
    }

    @Autowired BatchRunner     runner;
    @Autowired JobPlanner      planner;
    @Autowired BatchProperties props;
    @Autowired ConfigurableApplicationContext context;

    @Test
    void dryRun_plansFromBoundConfiguration() {
        assertThat(runner.getExitCode()).isZero();

        JobPlan plan = planner.plan(props.batchPath(), props.getScenes(), props.getExcludeScenes(),
                props.getCharacters());

        assertThat(plan.jobs()).extracting(Job::identity)
                .containsExactly("alice/idle", "alice/walk", "alice/wave");
        assertThat(plan.warnings()).containsExactly("alice/portrait: missing portrait.png");
        assertThat(props.getRetry().getRetryableStatusCodes()).containsExactly(404, 502, 503);
        assertThat(props.outputPath().resolve("progress.json")).doesNotExist();
    }

    @Test
    void batchServices_areScannedComponents() {
        for (String name : new String[]{"jobPlanner", "planPreview", "jobExecutor", "batchOrchestrator",
                "manifestWriter"}) {
            assertThat(context.getBeanFactory().getBeanDefinition(name).getFactoryMethodName())
                    .as(name).isNull();
        }
    }
}
