package com.genbatch.orchestrator.progress;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbatch.orchestrator.FakeTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProgressLedgerTest {

    private static final EntryMetadata META = new EntryMetadata("alice", "idle", "idle-api.json");

    @TempDir Path outputDir;

    FakeTime time;
    ProgressLedger ledger;

    @BeforeEach
    void setUp() {
        time   = new FakeTime();
        ledger = new ProgressLedger(outputDir, time);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    @Test
    void complete_marksCompletedAndPersists() throws IOException {
        ledger.start("alice/idle", META);
        time.advance(Duration.ofSeconds(42));
        ledger.complete("alice/idle", List.of("alice/idle.mp4"), Duration.ofSeconds(42));

        assertThat(ledger.isCompleted("alice/idle")).isTrue();

        JsonNode onDisk = new ObjectMapper().readTree(outputDir.resolve("progress.json").toFile());
        JsonNode entry = onDisk.path("jobs").path("alice/idle");
        assertThat(entry.path("status").asText()).isEqualTo("completed");
        assertThat(entry.path("duration_s").asDouble()).isEqualTo(42.0);
        assertThat(entry.path("files").get(0).asText()).isEqualTo("alice/idle.mp4");
        assertThat(entry.path("scene").asText()).isEqualTo("idle");
        assertThat(entry.has("error")).isFalse();
    }

    @Test
    void fail_isNotCompleted() {
        ledger.start("alice/idle", META);
        ledger.fail("alice/idle", "boom", Duration.ofSeconds(3));

        assertThat(ledger.isCompleted("alice/idle")).isFalse();
        assertThat(ledger.entry("alice/idle")).get()
                .extracting(ProgressEntry::status).isEqualTo(ProgressStatus.FAILED);
    }

    @Test
    void start_again_keepsOriginalStartTime() {
        Instant first = time.instant();
        ledger.start("alice/idle", META);
        time.advance(Duration.ofMinutes(5));
        ledger.fail("alice/idle", "boom", Duration.ofMinutes(5));
        time.advance(Duration.ofMinutes(1));
        ledger.start("alice/idle", META);

        assertThat(ledger.entry("alice/idle").orElseThrow().started()).isEqualTo(first);
    }

    @Test
    void fail_longError_truncatedTo200Chars() {
        ledger.start("alice/idle", META);
        ledger.fail("alice/idle", "x".repeat(500), Duration.ofSeconds(1));

        assertThat(ledger.entry("alice/idle").orElseThrow().error()).hasSize(ProgressLedger.MAX_ERROR_LENGTH);
    }

    @Test
    void complete_withoutPriorStart_takesCharacterFromIdentity() {
        ledger.complete("bob/walk", List.of("bob/walk.mp4"), Duration.ZERO);

        ProgressEntry entry = ledger.entry("bob/walk").orElseThrow();
        assertThat(entry.character()).isEqualTo("bob");
        assertThat(entry.is(ProgressStatus.COMPLETED)).isTrue();
    }

    // ------------------------------------------------------------------
    // Load / resume
    // ------------------------------------------------------------------

    @Test
    void reload_seesPreviousRunAndReportsInterruptedJobs() {
        ledger.start("alice/idle", META);
        ledger.complete("alice/idle", List.of("alice/idle.mp4"), Duration.ofSeconds(10));
        ledger.start("alice/walk", new EntryMetadata("alice", "walk", "walk-api.json"));
        ledger.start("alice/wave", new EntryMetadata("alice", "wave", "wave-api.json"));
        ledger.fail("alice/wave", "bad", Duration.ofSeconds(1));

        ProgressLedger reloaded = new ProgressLedger(outputDir, time);

        assertThat(reloaded.isCompleted("alice/idle")).isTrue();
        assertThat(reloaded.isCompleted("alice/walk")).isFalse();
        assertThat(reloaded.isCompleted("alice/wave")).isFalse();
        assertThat(reloaded.interruptedJobs()).containsExactly("alice/walk");
        assertThat(reloaded.count(ProgressStatus.FAILED)).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{bad", "[]", "null", "", "{\"jobs\":{\"a/b\":{\"status\":\"weird\"}}}"})
    void load_malformedFile_startsEmpty(String content) throws IOException {
        Files.writeString(outputDir.resolve(ProgressLedger.FILE_NAME), content);

        ProgressLedger loaded = new ProgressLedger(outputDir, time);

        assertThat(loaded.count(ProgressStatus.COMPLETED)).isZero();
        assertThat(loaded.interruptedJobs()).isEmpty();
        loaded.start("alice/idle", META);
        assertThat(loaded.entry("alice/idle")).isPresent();
    }

    @Test
    void load_unknownTopLevelFields_ignored() throws IOException {
        Files.writeString(outputDir.resolve(ProgressLedger.FILE_NAME),
                "{\"version\":3,\"jobs\":{\"alice/idle\":{\"status\":\"completed\",\"extra\":1}}}");

        assertThat(new ProgressLedger(outputDir, time).isCompleted("alice/idle")).isTrue();
    }

    @Test
    void reset_forgetsEverything() {
        ledger.complete("alice/idle", List.of("alice/idle.mp4"), Duration.ofSeconds(5));

        ledger.reset();

        assertThat(ledger.isCompleted("alice/idle")).isFalse();
        assertThat(outputDir.resolve(ProgressLedger.FILE_NAME)).doesNotExist();
        assertThat(new ProgressLedger(outputDir, time).count(ProgressStatus.COMPLETED)).isZero();
    }

    // ------------------------------------------------------------------
    // Write failures
    // ------------------------------------------------------------------

    @Test
    void failedWrite_rollsBackInMemoryState() throws IOException {
        ledger.start("alice/idle", META);
        // A directory where the temp file goes makes every write fail.
        Files.createDirectory(outputDir.resolve(ProgressLedger.FILE_NAME + ".tmp"));

        assertThatThrownBy(() -> ledger.complete("alice/idle", List.of("x.mp4"), Duration.ofSeconds(1)))
                .isInstanceOf(LedgerException.class);
        assertThat(ledger.isCompleted("alice/idle")).isFalse();
        assertThat(ledger.entry("alice/idle").orElseThrow().status()).isEqualTo(ProgressStatus.IN_PROGRESS);

        assertThatThrownBy(() -> ledger.start("bob/idle", META)).isInstanceOf(LedgerException.class);
        assertThat(ledger.entry("bob/idle")).isEmpty();
    }

    // ------------------------------------------------------------------
    // ETA and summary
    // ------------------------------------------------------------------

    @Test
    void estimateRemaining_noSamples_hasNoTimeEstimate() {
        ledger.complete("alice/idle", List.of("alice/idle.mp4"), Duration.ZERO);

        EtaEstimate eta = ledger.estimateRemaining(List.of("alice/idle", "alice/walk", "bob/idle", "bob/walk"), 2);

        assertThat(eta.done()).isEqualTo(1);
        assertThat(eta.remaining()).isEqualTo(3);
        assertThat(eta.remainingTime()).isEmpty();
        assertThat(eta.describe()).isEqualTo("Progress: 1/4 done | 3 remaining");
    }

    @Test
    void estimateRemaining_meanTimesRemainingOverWorkers() {
        ledger.complete("a/1", List.of("a/1.mp4"), Duration.ofMinutes(2));
        ledger.complete("a/2", List.of("a/2.mp4"), Duration.ofMinutes(4));

        EtaEstimate eta = ledger.estimateRemaining(List.of("a/1", "a/2", "a/3", "a/4", "a/5", "a/6"), 2);

        assertThat(eta.averageJob()).contains(Duration.ofMinutes(3));
        // 4 remaining * 3 min / 2 workers
        assertThat(eta.remainingTime()).contains(Duration.ofMinutes(6));
        assertThat(eta.describe()).contains("ETA: 6m 00s").contains("2 workers");
    }

    @Test
    void finalizeSummary_countsSkippedAsRemainder() throws IOException {
        ledger.complete("a/1", List.of("a/1.mp4"), Duration.ofSeconds(1));
        ledger.start("a/2", META);
        ledger.fail("a/2", "nope", Duration.ofSeconds(1));

        LedgerDocument.Summary summary = ledger.finalizeSummary(List.of("a/1", "a/2", "a/3", "a/4", "a/5"));

        assertThat(summary).isEqualTo(new LedgerDocument.Summary(5, 1, 1, 3));
        JsonNode onDisk = new ObjectMapper().readTree(outputDir.resolve("progress.json").toFile());
        assertThat(onDisk.path("summary").path("skipped").asInt()).isEqualTo(3);
        assertThat(onDisk.has("finished")).isTrue();
    }

    @Test
    void narrowerResume_countsOnlyPlannedJobs() {
        ledger.complete("a/1", List.of("a/1.mp4"), Duration.ofMinutes(1));
        ledger.complete("a/2", List.of("a/2.mp4"), Duration.ofMinutes(1));
        ledger.complete("b/1", List.of("b/1.mp4"), Duration.ofMinutes(1));
        ledger.start("b/2", META);
        ledger.fail("b/2", "nope", Duration.ofSeconds(1));
        List<String> planned = List.of("a/1", "a/3");

        EtaEstimate eta = ledger.estimateRemaining(planned, 1);
        LedgerDocument.Summary summary = ledger.finalizeSummary(planned);

        assertThat(eta.done()).isEqualTo(1);
        assertThat(eta.remaining()).isEqualTo(1);
        assertThat(summary).isEqualTo(new LedgerDocument.Summary(2, 1, 0, 1));
        assertThat(ledger.entry("b/1")).isPresent();
    }

    // ------------------------------------------------------------------
    // Concurrency
    // ------------------------------------------------------------------

    @Test
    void concurrentWorkers_allTransitionsLand() throws Exception {
        int threads = 8;
        int perThread = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(pool.submit(() -> {
                go.await();
                for (int i = 0; i < perThread; i++) {
                    String id = "c" + worker + "/s" + i;
                    ledger.start(id, new EntryMetadata("c" + worker, "s" + i, "w.json"));
                    ledger.complete(id, List.of(id + ".mp4"), Duration.ofSeconds(1));
                }
                return null;
            }));
        }
        go.countDown();
        for (Future<?> f : futures) f.get(30, TimeUnit.SECONDS);
        pool.shutdown();

        assertThat(ledger.count(ProgressStatus.COMPLETED)).isEqualTo(threads * perThread);
        assertThat(new ProgressLedger(outputDir, time).count(ProgressStatus.COMPLETED))
                .isEqualTo(threads * perThread);
    }
}
