package com.genbatch.orchestrator.progress;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable record of job progress for one batch output directory.
 *
 * Every public method holds the instance monitor, so concurrent worker loops
 * never interleave. Each mutation rewrites progress.json completely
 * (temp file, fsync, atomic rename) before returning. If that write fails the
 * mutation is undone in memory and a {@link LedgerException} is thrown, so the
 * caller never observes state that is not on disk.
 *
 * Resume semantics:
 *   completed   → skipped on the next run
 *   failed      → re-attempted
 *   in_progress → the previous run died mid-job; re-attempted
 */
public class ProgressLedger {

    private static final Logger log = LoggerFactory.getLogger(ProgressLedger.class);

    public static final String FILE_NAME = "progress.json";
    public static final int MAX_ERROR_LENGTH = 200;

    private final Path         path;
    private final Clock        clock;
    private final ObjectMapper json;

    private final Map<String, ProgressEntry> jobs = new LinkedHashMap<>();
    private Instant                started;
    private Instant                finished;
    private LedgerDocument.Summary  summary;
    private List<String>           interrupted = List.of();

    // Durations of jobs completed by this process; resumed entries are not samples.
    private final List<Duration> sessionDurations = new ArrayList<>();

    public ProgressLedger(Path outputDir, Clock clock) {
        this.path  = outputDir.resolve(FILE_NAME);
        this.clock = clock;
        this.json  = JsonMapper.builder()
                .findAndAddModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        load();
    }

    public Path path() {
        return path;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public synchronized boolean isCompleted(String identity) {
        ProgressEntry entry = jobs.get(identity);
        return entry != null && entry.is(ProgressStatus.COMPLETED);
    }

    public synchronized Optional<ProgressEntry> entry(String identity) {
        return Optional.ofNullable(jobs.get(identity));
    }

    public synchronized int count(ProgressStatus status) {
        return (int) jobs.values().stream().filter(e -> e.is(status)).count();
    }

    private int countAmong(Collection<String> identities, ProgressStatus status) {
        return (int) identities.stream()
                .map(jobs::get)
                .filter(e -> e != null && e.is(status))
                .count();
    }

    /** Identities left in_progress by a previous run, as found on load. */
    public synchronized List<String> interruptedJobs() {
        return interrupted;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    /** Record in_progress, keeping the original start time of an existing entry. */
    public synchronized void start(String identity, EntryMetadata meta) {
        Instant now = clock.instant();
        put(identity, new ProgressEntry(ProgressStatus.IN_PROGRESS,
                meta.character(), meta.scene(), meta.workflow(),
                startedOf(identity, now), null, null, null, null));
    }

    /** Terminal success; metadata comes from the existing entry. */
    public synchronized void complete(String identity, List<String> files, Duration duration) {
        complete(identity, metadataOf(identity), files, duration);
    }

    /**
     * Terminal success. A zero duration marks an artifact found on disk and is
     * not used as an ETA sample.
     */
    public synchronized void complete(String identity, EntryMetadata meta,
                                      List<String> files, Duration duration) {
        Instant now = clock.instant();
        put(identity, new ProgressEntry(ProgressStatus.COMPLETED,
                meta.character(), meta.scene(), meta.workflow(),
                startedOf(identity, now), now, seconds(duration),
                List.copyOf(files), null));
        if (!duration.isZero() && !duration.isNegative()) {
            sessionDurations.add(duration);
        }
    }

    public synchronized void fail(String identity, String error, Duration duration) {
        fail(identity, metadataOf(identity), error, duration);
    }

    public synchronized void fail(String identity, EntryMetadata meta, String error, Duration duration) {
        Instant now = clock.instant();
        put(identity, new ProgressEntry(ProgressStatus.FAILED,
                meta.character(), meta.scene(), meta.workflow(),
                startedOf(identity, now), now, seconds(duration),
                null, truncate(error)));
    }

    // ------------------------------------------------------------------
    // Batch level
    // ------------------------------------------------------------------

    /**
     * Mean duration of this run's completed jobs times the remaining count,
     * spread over {@code parallelism} workers. Only {@code planned} identities
     * are counted; entries left over from earlier, wider runs are ignored.
     */
    public synchronized EtaEstimate estimateRemaining(Collection<String> planned, int parallelism) {
        int total     = planned.size();
        int done      = countAmong(planned, ProgressStatus.COMPLETED);
        int remaining = Math.max(0, total - done);
        int workers   = Math.max(1, parallelism);
        if (sessionDurations.isEmpty()) {
            return new EtaEstimate(done, total, remaining, workers, Optional.empty(), Optional.empty());
        }
        long sumMillis = sessionDurations.stream().mapToLong(Duration::toMillis).sum();
        long avgMillis = sumMillis / sessionDurations.size();
        Duration eta = Duration.ofMillis(avgMillis * remaining / workers);
        return new EtaEstimate(done, total, remaining, workers,
                Optional.of(Duration.ofMillis(avgMillis)), Optional.of(eta));
    }

    /** Stamp the end of the run with {total, completed, failed, skipped} over the planned jobs. */
    public synchronized LedgerDocument.Summary finalizeSummary(Collection<String> planned) {
        int total     = planned.size();
        int completed = countAmong(planned, ProgressStatus.COMPLETED);
        int failed    = countAmong(planned, ProgressStatus.FAILED);
        Instant previousFinished = finished;
        LedgerDocument.Summary previousSummary = summary;

        finished = clock.instant();
        summary  = new LedgerDocument.Summary(total, completed, failed, total - completed - failed);
        try {
            flush();
        } catch (LedgerException e) {
            finished = previousFinished;
            summary  = previousSummary;
            throw e;
        }
        return summary;
    }

    /** Forget all prior progress (fresh run without resume). */
    public synchronized void reset() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new LedgerException("Cannot delete " + path, e);
        }
        jobs.clear();
        sessionDurations.clear();
        interrupted = List.of();
        started  = clock.instant();
        finished = null;
        summary  = null;
        log.info("Progress reset: {}", path);
    }

    // ------------------------------------------------------------------
    // Persistence
    // ------------------------------------------------------------------

    private void load() {
        started = clock.instant();
        if (!Files.exists(path)) return;
        try {
            LedgerDocument doc = json.readValue(path.toFile(), LedgerDocument.class);
            if (doc == null) {
                throw new IOException("document is null");
            }
            if (doc.started() != null) started = doc.started();
            if (doc.jobs() != null) {
                doc.jobs().forEach((identity, entry) -> {
                    if (identity != null && entry != null) jobs.put(identity, entry);
                });
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable progress file {}, starting with no prior progress: {}",
                    path, e.getMessage());
            jobs.clear();
            started = clock.instant();
            return;
        }

        interrupted = jobs.entrySet().stream()
                .filter(e -> e.getValue().is(ProgressStatus.IN_PROGRESS))
                .map(Map.Entry::getKey)
                .toList();
        log.info("Loaded {}: {} completed, {} failed, {} interrupted",
                path, count(ProgressStatus.COMPLETED), count(ProgressStatus.FAILED), interrupted.size());
        if (!interrupted.isEmpty()) {
            log.warn("Interrupted job(s) from a previous run will be re-attempted: {}",
                    String.join(", ", interrupted));
        }
    }

    private void put(String identity, ProgressEntry entry) {
        ProgressEntry previous = jobs.put(identity, entry);
        try {
            flush();
        } catch (LedgerException e) {
            if (previous == null) jobs.remove(identity);
            else jobs.put(identity, previous);
            throw e;
        }
    }

    private void flush() {
        LedgerDocument doc = new LedgerDocument(started, new LinkedHashMap<>(jobs), finished, summary);
        Path tmp = path.resolveSibling(FILE_NAME + ".tmp");
        try {
            Files.createDirectories(path.getParent());
            ByteBuffer buf = ByteBuffer.wrap(json.writeValueAsBytes(doc));
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LedgerException("Cannot write " + path, e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private Instant startedOf(String identity, Instant fallback) {
        ProgressEntry existing = jobs.get(identity);
        return existing != null && existing.started() != null ? existing.started() : fallback;
    }

    private EntryMetadata metadataOf(String identity) {
        ProgressEntry existing = jobs.get(identity);
        if (existing == null) {
            String character = identity.contains("/") ? identity.substring(0, identity.indexOf('/')) : identity;
            return new EntryMetadata(character, null, null);
        }
        return new EntryMetadata(existing.character(), existing.scene(), existing.workflow());
    }

    private static Double seconds(Duration d) {
        return Math.round(d.toMillis() / 100.0) / 10.0;
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
