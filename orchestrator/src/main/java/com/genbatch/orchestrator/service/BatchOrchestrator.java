package com.genbatch.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.execution.JobExecutor;
import com.genbatch.orchestrator.execution.JobReport;
import com.genbatch.orchestrator.execution.WorkflowResolver;
import com.genbatch.orchestrator.job.JobPlan;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.model.ManifestEntry;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.progress.Durations;
import com.genbatch.orchestrator.progress.LedgerDocument;
import com.genbatch.orchestrator.progress.ProgressLedger;
import com.genbatch.orchestrator.worker.WorkerControllerFactory;
import com.genbatch.orchestrator.worker.WorkerLifecycleController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fans a planned batch out over workers.
 *
 * Jobs are partitioned by character, one worker loop runs per partition on a
 * fixed thread pool, and each loop owns its worker from provisioning to
 * teardown. Inside a loop jobs run strictly in order. The progress ledger is
 * the only thing the loops share.
 *
 * A loop that loses its worker ends early; its remaining jobs stay open in the
 * ledger for the next run. Sibling loops are not affected.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final JobExecutor             executor;
    private final WorkerControllerFactory workers;
    private final ProgressLedger          ledger;
    private final ManifestWriter          manifest;
    private final BatchProperties         props;
    private final ObjectMapper            json;
    private final Clock                   clock;

    public BatchOrchestrator(JobExecutor executor, WorkerControllerFactory workers, ProgressLedger ledger,
                             ManifestWriter manifest, BatchProperties props, ObjectMapper json, Clock clock) {
        this.executor = executor;
        this.workers  = workers;
        this.ledger   = ledger;
        this.manifest = manifest;
        this.props    = props;
        this.json     = json;
        this.clock    = clock;
    }

    // ------------------------------------------------------------------
    // Partitioning
    // ------------------------------------------------------------------

    /**
     * Group jobs by character (first-seen order) and deal the groups
     * round-robin over {@code workerCount} buckets. Empty buckets are dropped.
     */
    public static List<List<Job>> partition(List<Job> jobs, int workerCount) {
        if (workerCount < 1) throw new IllegalArgumentException("workerCount must be >= 1");
        Map<String, List<Job>> byCharacter = new LinkedHashMap<>();
        for (Job job : jobs) {
            byCharacter.computeIfAbsent(job.character(), c -> new ArrayList<>()).add(job);
        }
        List<List<Job>> buckets = new ArrayList<>();
        for (int i = 0; i < workerCount; i++) buckets.add(new ArrayList<>());
        int i = 0;
        for (List<Job> group : byCharacter.values()) {
            buckets.get(i++ % workerCount).addAll(group);
        }
        return buckets.stream().filter(b -> !b.isEmpty()).map(List::copyOf).toList();
    }

    /** min(characters, max-workers) in parallel mode, else 1. Attach mode is always 1. */
    public int workerCount(JobPlan plan) {
        if (!props.isParallel() || workers.isAttachMode()) return 1;
        int characters = plan.jobCharacters().size();
        return Math.max(1, Math.min(characters, props.getMaxWorkers()));
    }

    // ------------------------------------------------------------------
    // Run
    // ------------------------------------------------------------------

    public BatchResult run(JobPlan plan) {
        Instant started = clock.instant();
        List<Job> jobs = plan.jobs();
        List<String> identities = jobs.stream().map(Job::identity).toList();
        List<List<Job>> partitions = partition(jobs, workerCount(plan));
        int parallelism = partitions.size();

        log.info("Running {} job(s) on {} worker(s)", jobs.size(), parallelism);

        ExecutorService pool = Executors.newFixedThreadPool(parallelism);
        List<Future<PartitionResult>> futures = new ArrayList<>();
        List<WorkerContext> contexts = new ArrayList<>();
        for (int i = 0; i < parallelism; i++) {
            WorkerContext ctx = WorkerContext.of(i, identities, parallelism);
            List<Job> partition = partitions.get(i);
            contexts.add(ctx);
            futures.add(pool.submit(() -> runPartition(ctx, partition)));
        }

        List<PartitionResult> results = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                results.add(join(futures.get(i), contexts.get(i), partitions.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }

        LedgerDocument.Summary summary = finalizeLedger(identities);
        BatchResult result = new BatchResult(results, summary,
                Duration.between(started, clock.instant()), writeManifest(results));
        logSummary(result);
        return result;
    }

    /** One worker loop. Never throws. */
    PartitionResult runPartition(WorkerContext ctx, List<Job> partition) {
        List<JobReport> reports = new ArrayList<>();
        List<Job> pending = new ArrayList<>();
        for (Job job : partition) {
            if (ledger.isCompleted(job.identity())) {
                reports.add(JobReport.skipped(job, null));
            } else {
                pending.add(job);
            }
        }
        if (pending.isEmpty()) {
            log.info("[{}] All {} job(s) already done, no worker needed", ctx.label(), partition.size());
            return new PartitionResult(ctx, reports, null, List.of());
        }
        log.info("[{}] Starting: {} job(s) ({} already done) for {}", ctx.label(), pending.size(),
                partition.size() - pending.size(), String.join(", ", characters(pending)));

        WorkerLifecycleController worker = workers.create(ctx);
        WorkflowResolver workflows = new WorkflowResolver(localWorkflowDir(),
                props.getWorker().getWorkflowDirs(), props.getWorker().getServiceDir(), json);
        int done = 0;
        try {
            worker.provision();
            worker.startService();
            for (Job job : pending) {
                reports.add(executor.process(ctx, job, partition.indexOf(job) + 1, partition.size(),
                        worker, workflows));
                done++;
            }
            log.info("[{}] All jobs complete. {} file(s) generated.", ctx.label(),
                    reports.stream().filter(r -> r.status() == JobReport.Status.COMPLETED).count());
            return new PartitionResult(ctx, reports, null, List.of());
        } catch (RuntimeException e) {
            List<Job> abandoned = pending.subList(done, pending.size());
            log.error("[{}] FATAL: {} ({} job(s) left for a later run)", ctx.label(), e.getMessage(),
                    abandoned.size(), e);
            return new PartitionResult(ctx, reports, e.getMessage(), abandoned);
        } finally {
            worker.teardown();
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private PartitionResult join(Future<PartitionResult> future, WorkerContext ctx, List<Job> partition) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("[{}] Worker loop crashed: {}", ctx.label(), e.getCause().getMessage(), e.getCause());
            return new PartitionResult(ctx, List.of(), String.valueOf(e.getCause().getMessage()), partition);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new PartitionResult(ctx, List.of(), "interrupted", partition);
        }
    }

    private LedgerDocument.Summary finalizeLedger(List<String> identities) {
        try {
            return ledger.finalizeSummary(identities);
        } catch (RuntimeException e) {
            log.error("Could not finalize progress ledger: {}", e.getMessage());
            return null;
        }
    }

    private Path writeManifest(List<PartitionResult> results) {
        List<ManifestEntry> entries = new ArrayList<>();
        Path outputDir = props.outputPath();
        for (PartitionResult r : results) {
            for (JobReport report : r.reports()) {
                if (report.status() != JobReport.Status.COMPLETED) continue;
                String rel = outputDir.relativize(report.artifact().toAbsolutePath()).toString().replace('\\', '/');
                entries.add(new ManifestEntry(report.job().character(), report.job().sceneLabel(), rel));
            }
        }
        if (entries.isEmpty()) return null;
        try {
            return manifest.write(outputDir, entries);
        } catch (RuntimeException e) {
            log.error("Could not write manifest: {}", e.getMessage());
            return null;
        }
    }

    private void logSummary(BatchResult result) {
        log.info("==================================================");
        log.info("Batch finished in {}: {} completed, {} failed, {} skipped",
                Durations.format(result.wallTime()),
                result.count(JobReport.Status.COMPLETED),
                result.count(JobReport.Status.FAILED),
                result.count(JobReport.Status.SKIPPED));
        for (PartitionResult p : result.partitions()) {
            if (p.isFatal()) {
                log.error("  {} stopped early: {} ({} job(s) not attempted)",
                        p.context().label(), p.fatalError(), p.abandoned().size());
            }
        }
        Map<String, List<String>> byCharacter = new TreeMap<>();
        for (JobReport r : result.produced()) {
            byCharacter.computeIfAbsent(r.job().character(), c -> new ArrayList<>())
                    .add(r.artifact().getFileName().toString());
        }
        byCharacter.forEach((character, files) ->
                log.info("  {}/: {}", character, String.join(", ", files)));
        for (JobReport r : result.reports()) {
            if (r.status() == JobReport.Status.FAILED) {
                log.error("  FAILED {}: {}", r.job().identity(), r.error());
            }
        }
        if (result.summary() != null) {
            log.info("Ledger summary: {}", result.summary());
        }
    }

    private Path localWorkflowDir() {
        String dir = props.getWorker().getLocalWorkflowDir();
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }

    private static List<String> characters(List<Job> jobs) {
        return jobs.stream().map(Job::character).distinct().sorted().toList();
    }
}
