package com.genbatch.orchestrator.service;

import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.job.Destinations;
import com.genbatch.orchestrator.job.JobPlan;
import com.genbatch.orchestrator.job.SceneCatalog;
import com.genbatch.orchestrator.model.CharacterAssets;
import com.genbatch.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Logs the execution plan before anything is provisioned, so a wrong scene
 * filter or a missing seed is visible while it is still free to fix.
 */
@Component
public class PlanPreview {

    private static final Logger log = LoggerFactory.getLogger(PlanPreview.class);

    private static final String RULE = "=".repeat(70);

    private final SceneCatalog catalog;
    private final Path         outputDir;
    private final int          minutesPerJob;

    public PlanPreview(SceneCatalog catalog, BatchProperties props) {
        this.catalog       = catalog;
        this.outputDir     = props.outputPath();
        this.minutesPerJob = props.getEstimatedMinutesPerJob();
    }

    /** @return number of jobs whose artifact already exists */
    public int show(JobPlan plan, int workerCount) {
        Set<String> existing = new HashSet<>();
        for (Job job : plan.jobs()) {
            if (Destinations.existing(job).isPresent()) existing.add(job.identity());
        }
        int pending = plan.size() - existing.size();

        log.info(RULE);
        log.info("GENERATION PLAN");
        log.info(RULE);
        log.info("Characters:  {}", plan.characters().size());
        log.info("Scenes:      {}", plan.scenes().size());
        log.info("Total jobs:  {}{}", plan.size(), existing.isEmpty() ? ""
                : " (" + existing.size() + " already done, " + pending + " to run)");
        log.info("Output dir:  {}", outputDir);
        if (workerCount > 1) {
            log.info("Workers:     {} (parallel)", workerCount);
            log.info("Est. time:   ~{} min ({} jobs / {} workers x ~{} min each)",
                    pending * minutesPerJob / workerCount, pending, workerCount, minutesPerJob);
        } else {
            log.info("Est. time:   ~{} min ({} jobs x ~{} min each)",
                    pending * minutesPerJob, pending, minutesPerJob);
        }

        for (CharacterAssets character : plan.characters()) {
            List<Job> jobs = plan.jobs().stream()
                    .filter(j -> j.character().equals(character.name()))
                    .toList();
            log.info("");
            log.info("  {}/ ({}) - {} scene(s):", character.name(),
                    String.join(", ", character.presentSeeds()), jobs.size());
            log.info("    {} {} {} {}", pad("Scene", 20), pad("Seed", 14), pad("Workflow", 28), "Output");
            for (Job job : jobs) {
                String seed = catalog.find(job.sceneLabel()).map(s -> s.seedFile())
                        .orElse(job.seed().getFileName().toString());
                log.info("    {} {} {} {}/{}{}", pad(job.sceneLabel(), 20), pad(seed, 14),
                        pad(job.workflowRef(), 28), job.character(), job.destinationName(),
                        existing.contains(job.identity()) ? " [EXISTS]" : "");
            }
        }

        if (!plan.warnings().isEmpty()) {
            log.info("");
            log.info("  Skipped ({}):", plan.warnings().size());
            plan.warnings().forEach(w -> log.info("    ! {}", w));
        }

        if (workerCount > 1) {
            List<List<Job>> partitions = BatchOrchestrator.partition(plan.jobs(), workerCount);
            log.info("");
            log.info("  Worker allocation ({} workers):", partitions.size());
            for (int i = 0; i < partitions.size(); i++) {
                List<String> chars = partitions.get(i).stream()
                        .map(Job::character).distinct().sorted().toList();
                log.info("    worker-{}: {} job(s) - {}", i + 1, partitions.get(i).size(),
                        String.join(", ", chars));
            }
        }
        log.info(RULE);
        return existing.size();
    }

    private static String pad(String s, int width) {
        return String.format("%-" + width + "s", s);
    }
}
