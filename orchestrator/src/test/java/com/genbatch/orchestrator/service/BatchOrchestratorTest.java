package com.genbatch.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.FakeTime;
import com.genbatch.orchestrator.config.BatchProperties;
import com.genbatch.orchestrator.execution.JobExecutor;
import com.genbatch.orchestrator.execution.JobReport;
import com.genbatch.orchestrator.job.JobPlan;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.model.WorkerContext;
import com.genbatch.orchestrator.progress.EntryMetadata;
import com.genbatch.orchestrator.progress.LedgerDocument;
import com.genbatch.orchestrator.progress.ProgressLedger;
import com.genbatch.orchestrator.worker.WorkerControllerFactory;
import com.genbatch.orchestrator.worker.WorkerLifecycleController;
import com.genbatch.orchestrator.worker.WorkerUnrecoverableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BatchOrchestratorTest {

    private final ObjectMapper json = new ObjectMapper();

    @Mock JobExecutor               executor;
    @Mock WorkerControllerFactory   workers;
    @Mock WorkerLifecycleController healthy;
    @Mock WorkerLifecycleController failing;

    @TempDir Path outputDir;

    BatchProperties props;
    FakeTime time;
    ProgressLedger ledger;
    BatchOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        props = new BatchProperties();
        props.setOutputDir(outputDir.toString());
        time   = new FakeTime();
        ledger = new ProgressLedger(props.outputPath(), time);
        orchestrator = new BatchOrchestrator(executor, workers, ledger, new ManifestWriter(json),
                props, json, time);
    }

    // ------------------------------------------------------------------
    // partition() / workerCount()
    // ------------------------------------------------------------------

    @Test
    void partition_keepsCharactersTogetherAndCoversEveryJobOnce() {
        List<Job> jobs = new ArrayList<>();
        for (String c : List.of("ann", "ben", "cat", "dan", "eve")) {
            jobs.add(job(c, "idle"));
            jobs.add(job(c, "walk"));
        }

        List<List<Job>> parts = BatchOrchestrator.partition(jobs, 2);

        assertThat(parts).hasSize(2);
        assertThat(parts.get(0)).extracting(Job::character)
                .containsExactly("ann", "ann", "cat", "cat", "eve", "eve");
        assertThat(parts.get(1)).extracting(Job::character)
                .containsExactly("ben", "ben", "dan", "dan");
        assertThat(parts.stream().flatMap(List::stream).toList()).containsExactlyInAnyOrderElementsOf(jobs);
        assertThat(parts.get(0).get(0).identity()).isEqualTo("ann/idle");
        assertThat(parts.get(0).get(1).identity()).isEqualTo("ann/walk");
    }

    @Test
    void partition_moreWorkersThanCharacters_dropsEmptyBuckets() {
        List<List<Job>> parts = BatchOrchestrator.partition(List.of(job("ann", "idle"), job("ben", "idle")), 5);

        assertThat(parts).hasSize(2);
    }

    @Test
    void workerCount_sequentialParallelAndAttach() {
        JobPlan plan = plan(job("ann", "idle"), job("ben", "idle"), job("cat", "idle"));

        assertThat(orchestrator.workerCount(plan)).isEqualTo(1);

        props.setParallel(true);
        props.setMaxWorkers(2);
        assertThat(orchestrator.workerCount(plan)).isEqualTo(2);
        props.setMaxWorkers(5);
        assertThat(orchestrator.workerCount(plan)).isEqualTo(3);

        when(workers.isAttachMode()).thenReturn(true);
        assertThat(orchestrator.workerCount(plan)).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // run()
    // ------------------------------------------------------------------

    @Test
    void run_resume_completedJobsNeverReachTheExecutor() throws Exception {
        Job idle = job("ann", "idle");
        Job walk = job("ann", "walk");
        ledger.complete(idle.identity(), EntryMetadata.of(idle), List.of("ann/idle.mp4"), Duration.ofSeconds(30));
        when(workers.create(any())).thenReturn(healthy);
        when(executor.process(any(), eq(walk), anyInt(), anyInt(), eq(healthy), any()))
                .thenReturn(completed(walk));

        BatchResult result = orchestrator.run(plan(idle, walk));

        verify(executor, never()).process(any(), eq(idle), anyInt(), anyInt(), any(), any());
        verify(executor).process(any(), eq(walk), eq(2), eq(2), eq(healthy), any());
        assertThat(result.count(JobReport.Status.SKIPPED)).isEqualTo(1);
        assertThat(result.count(JobReport.Status.COMPLETED)).isEqualTo(1);
        verify(healthy).provision();
        verify(healthy).startService();
        verify(healthy).teardown();
    }

    @Test
    void run_everythingDone_noWorkerProvisioned() {
        Job idle = job("ann", "idle");
        ledger.complete(idle.identity(), EntryMetadata.of(idle), List.of("ann/idle.mp4"), Duration.ofSeconds(30));

        BatchResult result = orchestrator.run(plan(idle));

        verify(workers, never()).create(any());
        assertThat(result.manifest()).isNull();
        assertThat(result.summary()).isEqualTo(new LedgerDocument.Summary(1, 1, 0, 0));
    }

    @Test
    void run_oneWorkerDies_siblingStillFinishesAndManifestListsItsOutput() throws Exception {
        props.setParallel(true);
        Job ann = job("ann", "idle");
        Job ben = job("ben", "idle");
        when(workers.isAttachMode()).thenReturn(false);
        when(workers.create(any())).thenAnswer(inv ->
                inv.getArgument(0, WorkerContext.class).index() == 0 ? failing : healthy);
        doThrow(new WorkerUnrecoverableException("pod never came up")).when(failing).provision();
        when(executor.process(any(), eq(ben), anyInt(), anyInt(), eq(healthy), any()))
                .thenReturn(completed(ben));

        BatchResult result = orchestrator.run(plan(ann, ben));

        assertThat(result.partitions()).hasSize(2);
        PartitionResult dead = result.partitions().get(0);
        assertThat(dead.isFatal()).isTrue();
        assertThat(dead.fatalError()).contains("pod never came up");
        assertThat(dead.abandoned()).containsExactly(ann);
        assertThat(result.partitions().get(1).isFatal()).isFalse();
        verify(failing).teardown();
        verify(healthy).teardown();

        JsonNode manifest = json.readTree(result.manifest().toFile());
        assertThat(manifest).hasSize(1);
        assertThat(manifest.get(0).path("character").asText()).isEqualTo("ben");
        assertThat(manifest.get(0).path("scene").asText()).isEqualTo("idle");
        assertThat(manifest.get(0).path("file").asText()).isEqualTo("ben/idle.mp4");
        assertThat(result.summary()).isEqualTo(new LedgerDocument.Summary(2, 0, 0, 2));
    }

    @Test
    void runPartition_workerLostMidway_remainingJobsAbandoned() {
        Job a = job("ann", "idle");
        Job b = job("ann", "walk");
        Job c = job("ann", "wave");
        when(workers.create(any())).thenReturn(healthy);
        when(executor.process(any(), eq(a), anyInt(), anyInt(), any(), any())).thenReturn(completed(a));
        when(executor.process(any(), eq(b), anyInt(), anyInt(), any(), any()))
                .thenThrow(new WorkerUnrecoverableException("service gone"));

        PartitionResult result = orchestrator.runPartition(WorkerContext.of(0, List.of(a.identity(), b.identity(), c.identity()), 1), List.of(a, b, c));

        assertThat(result.isFatal()).isTrue();
        assertThat(result.reports()).hasSize(1);
        assertThat(result.abandoned()).containsExactly(b, c);
        verify(executor, never()).process(any(), eq(c), anyInt(), anyInt(), any(), any());
        verify(healthy).teardown();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job job(String character, String scene) {
        return Job.of(character, scene, scene + "-api.json",
                Path.of("/batch", character, "clothed.png"), props.outputPath().resolve(character));
    }

    private static JobPlan plan(Job... jobs) {
        return new JobPlan(List.of(), List.of(), List.of(jobs), List.of());
    }

    private static JobReport completed(Job job) {
        return new JobReport(job, JobReport.Status.COMPLETED, job.destinationFor(".mp4"), null,
                Duration.ofMinutes(3), 1);
    }
}
