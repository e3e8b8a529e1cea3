package com.genbatch.orchestrator.execution;

import com.genbatch.orchestrator.Sleeper;
import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.generation.ArtifactRef;
import com.genbatch.orchestrator.generation.GenerationClient;
import com.genbatch.orchestrator.generation.GenerationException;
import com.genbatch.orchestrator.generation.HistoryEntry;
import com.genbatch.orchestrator.generation.WorkflowGraph;
import com.genbatch.orchestrator.job.Destinations;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.progress.Durations;
import com.genbatch.orchestrator.progress.EntryMetadata;
import com.genbatch.orchestrator.progress.ProgressLedger;
import com.genbatch.orchestrator.worker.WorkerException;
import com.genbatch.orchestrator.worker.WorkerLifecycleController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs one job against one ready worker and records the outcome.
 *
 * Per job:
 *   1. skip if the ledger says completed, or the artifact is already on disk
 *   2. ledger.start
 *   3. attempt: ensureReady → workflow → upload → submit → await → fetch
 *   4. Transient outcome within the retry budget → backoff, back to 3
 *   5. ledger.complete or ledger.fail
 *
 * Job failures never escape {@link #process}. A {@link WorkerException}
 * does: the worker is gone, so the job stays in_progress for a later resume
 * and the caller abandons the partition.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ProgressLedger  ledger;
    private final ErrorClassifier classifier;
    private final RetryPolicy     retry;
    private final Clock           clock;
    private final Sleeper         sleeper;
    private final Path            outputDir;
    private final Duration        generationTimeout;
    private final String          defaultExtension;
    private final String          serviceDir;

    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter skippedCounter;
    private final Counter retryCounter;
    private final Timer   durationTimer;

    public JobExecutor(ProgressLedger ledger, ErrorClassifier classifier, RetryPolicy retry,
                       BatchProperties props, MeterRegistry meters, Clock clock, Sleeper sleeper) {
        this.ledger            = ledger;
        this.classifier        = classifier;
        this.retry             = retry;
        this.clock             = clock;
        this.sleeper           = sleeper;
        this.outputDir         = props.outputPath();
        this.generationTimeout = props.getGenerationTimeout();
        this.defaultExtension  = props.getDefaultArtifactExtension();
        this.serviceDir        = props.getWorker().getServiceDir();

        this.completedCounter = meters.counter("genbatch.jobs", "outcome", "completed");
        this.failedCounter    = meters.counter("genbatch.jobs", "outcome", "failed");
        this.skippedCounter   = meters.counter("genbatch.jobs", "outcome", "skipped");
        this.retryCounter     = meters.counter("genbatch.job.retries");
        this.durationTimer    = Timer.builder("genbatch.job.duration")
                .description("Wall time of executed jobs, retries included")
                .register(meters);
    }

    /**
     * @param position 1-based index of the job inside its partition
     * @throws WorkerException if the worker becomes unusable
     */
    public JobReport process(WorkerContext ctx, Job job, int position, int partitionSize,
                             WorkerLifecycleController worker, WorkflowResolver workflows) {
        String id = job.identity();
        log.info("[{}] [{}/{}] {}  (workflow {}, seed {})", ctx.label(), position, partitionSize,
                id, job.workflowRef(), job.seed().getFileName());

        if (ledger.isCompleted(id)) {
            log.info("[{}]   already done, skipping", ctx.label());
            skippedCounter.increment();
            return JobReport.skipped(job, null);
        }
        Optional<Path> existing = Destinations.existing(job);
        if (existing.isPresent()) {
            log.info("[{}]   SKIP: output already exists: {}", ctx.label(), existing.get().getFileName());
            ledger.complete(id, EntryMetadata.of(job), List.of(relative(existing.get())), Duration.ZERO);
            skippedCounter.increment();
            return JobReport.skipped(job, existing.get());
        }

        ledger.start(id, EntryMetadata.of(job));
        Instant started = clock.instant();

        Outcome outcome;
        int attempt = 0;
        while (true) {
            attempt++;
            outcome = attempt(ctx, job, worker, workflows);
            if (!(outcome instanceof Outcome.Transient t) || attempt > retry.maxRetries()) break;

            Duration backoff = retry.backoffFor(attempt);
            log.warn("[{}]   Transient error (attempt {}/{}): {}; retrying in {}s",
                    ctx.label(), attempt, retry.maxAttempts(), t.reason(), backoff.getSeconds());
            retryCounter.increment();
            pause(backoff);
        }

        Duration took = Duration.between(started, clock.instant());
        durationTimer.record(took);

        if (outcome instanceof Outcome.Success s) {
            ledger.complete(id, List.of(relative(s.artifact())), took);
            completedCounter.increment();
            log.info("[{}]   Saved {} in {}", ctx.label(), relative(s.artifact()), Durations.format(took));
            logEta(ctx);
            return JobReport.completed(job, s.artifact(), took, attempt);
        }

        String reason = outcome instanceof Outcome.Terminal term ? term.reason()
                : ((Outcome.Transient) outcome).reason() + " (gave up after " + attempt + " attempts)";
        ledger.fail(id, reason, took);
        failedCounter.increment();
        log.error("[{}]   FAILED {}: {} (after {})", ctx.label(), id, reason, Durations.format(took));
        logEta(ctx);
        return JobReport.failed(job, reason, took, attempt);
    }

    // ------------------------------------------------------------------
    // One attempt
    // ------------------------------------------------------------------

    private Outcome attempt(WorkerContext ctx, Job job, WorkerLifecycleController worker,
                            WorkflowResolver workflows) {
        try {
            worker.ensureReady();
            GenerationClient client = worker.client();

            WorkflowGraph graph = workflows.load(ctx, job.workflowRef(), worker.shell());
            String uploaded = upload(ctx, job, worker);
            WorkflowGraph prepared = graph.withInputImage(uploaded);

            String correlationId = UUID.randomUUID().toString();
            String requestId = client.submit(prepared.document(), correlationId);
            log.info("[{}]   Submitted, request {}", ctx.label(), requestId);

            HistoryEntry done = client.awaitCompletion(ctx.label(), requestId, correlationId, generationTimeout);
            List<ArtifactRef> files = done.artifacts();
            ArtifactRef last = done.finalArtifact()
                    .orElseThrow(() -> new NoArtifactException("Request " + requestId + " produced no output files"));
            if (files.size() > 1) {
                log.info("[{}]   Workflow produced {} files, saving final only", ctx.label(), files.size());
            }

            Path dest = job.destinationFor(last.extensionOr(defaultExtension));
            fetch(ctx, last, dest, worker);
            return Outcome.success(dest);
        } catch (WorkerException e) {
            throw e;
        } catch (Exception e) {
            return classifier.classify(e, () -> worker.client().isHealthy());
        }
    }

    /** Native upload, falling back to a shell copy into the service input directory. */
    private String upload(WorkerContext ctx, Job job, WorkerLifecycleController worker) {
        String name = job.character() + "_" + job.seed().getFileName();
        log.info("[{}]   Uploading {}", ctx.label(), name);
        try {
            return worker.client().upload(job.seed(), name);
        } catch (GenerationException e) {
            log.warn("[{}]   Upload failed ({}), copying over shell", ctx.label(), e.getMessage());
            worker.shell().upload(job.seed(), serviceDir + "/input/" + name);
            return name;
        }
    }

    /** Native download, falling back to the shell; the file appears atomically. */
    private void fetch(WorkerContext ctx, ArtifactRef ref, Path dest, WorkerLifecycleController worker) {
        Path part = dest.resolveSibling(dest.getFileName() + ".part");
        log.info("[{}]   Downloading {} -> {}", ctx.label(), ref.filename(), dest.getFileName());
        try {
            Files.createDirectories(dest.getParent());
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot create " + dest.getParent(), e);
        }
        try {
            try {
                byte[] bytes = worker.client().fetchArtifact(ref);
                Files.write(part, bytes);
            } catch (GenerationException e) {
                log.warn("[{}]   Download failed ({}), copying over shell", ctx.label(), e.getMessage());
                worker.shell().download(serviceDir + "/" + ref.kind() + "/" + ref.relativePath(), part);
            }
            Files.move(part, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactWriteException("Cannot write " + dest, e);
        } finally {
            try {
                Files.deleteIfExists(part);
            } catch (IOException e) {
                log.warn("[{}]   Could not remove {}: {}", ctx.label(), part, e.getMessage());
            }
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void logEta(WorkerContext ctx) {
        log.info("[{}]   {}", ctx.label(),
                ledger.estimateRemaining(ctx.planned(), ctx.parallelism()).describe());
    }

    private String relative(Path artifact) {
        Path rel = artifact.toAbsolutePath().startsWith(outputDir)
                ? outputDir.relativize(artifact.toAbsolutePath())
                : artifact.getFileName();
        return rel.toString().replace('\\', '/');
    }

    private void pause(Duration d) {
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkerException("Interrupted during retry backoff", e);
        }
    }
}
