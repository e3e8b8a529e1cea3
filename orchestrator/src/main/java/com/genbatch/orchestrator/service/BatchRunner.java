package com.genbatch.orchestrator.service;

import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.job.JobPlan;
import com.genbatch.orchestrator.job.JobPlanner;
import com.genbatch.orchestrator.job.NotFoundException;
import com.genbatch.orchestrator.job.ValidationException;
import com.genbatch.orchestrator.progress.ProgressLedger;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Entry point of a batch run: plan, preview, execute.
 *
 * Exit code is 1 only when no valid job list could be built. Failed jobs and
 * dead workers are reported in the log and the ledger, not in the exit code.
 *
 * To run:
 *   RUNPOD_API_KEY=... java -jar orchestrator.jar \
 *       --genbatch.batch-dir=/data/batch5 --genbatch.output-dir=/data/batch5/out
 */
@Component
public class BatchRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BatchRunner.class);

    private final JobPlanner        planner;
    private final BatchOrchestrator orchestrator;
    private final PlanPreview       preview;
    private final ProgressLedger    ledger;
    private final BatchProperties   props;
    private final MeterRegistry     meters;

    private int exitCode = 0;

    public BatchRunner(JobPlanner planner, BatchOrchestrator orchestrator, PlanPreview preview,
                       ProgressLedger ledger, BatchProperties props, MeterRegistry meters) {
        this.planner      = planner;
        this.orchestrator = orchestrator;
        this.preview      = preview;
        this.ledger       = ledger;
        this.props        = props;
        this.meters       = meters;
    }

    @Override
    public void run(String... args) {
        JobPlan plan;
        try {
            plan = planner.plan(props.batchPath(), props.getScenes(), props.getExcludeScenes(),
                    props.getCharacters());
        } catch (ValidationException | NotFoundException e) {
            log.error("Cannot plan batch: {}", e.getMessage());
            exitCode = 1;
            return;
        }

        preview.show(plan, orchestrator.workerCount(plan));
        if (props.isDryRun()) {
            log.info("Dry run: nothing executed");
            return;
        }
        if (!props.isResume()) {
            ledger.reset();
        }

        orchestrator.run(plan);
        logMetrics();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void logMetrics() {
        for (Meter meter : meters.getMeters()) {
            if (!meter.getId().getName().startsWith("genbatch.")) continue;
            meter.measure().forEach(m -> log.info("  metric {}{} {}={}", meter.getId().getName(),
                    meter.getId().getTags(), m.getStatistic().getTagValueRepresentation(), m.getValue()));
        }
    }
}
