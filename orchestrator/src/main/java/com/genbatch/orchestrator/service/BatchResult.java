package com.genbatch.orchestrator.service;

import com.genbatch.orchestrator.execution.JobReport;
import com.genbatch.orchestrator.progress.LedgerDocument;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Everything a finished batch run produced.
 *
 * @param summary  ledger summary, null if it could not be written
 * @param manifest manifest file, null when no artifact was produced
 */
public record BatchResult(List<PartitionResult> partitions, LedgerDocument.Summary summary,
                          Duration wallTime, Path manifest) {

    public List<JobReport> reports() {
        return partitions.stream().flatMap(p -> p.reports().stream()).toList();
    }

    public long count(JobReport.Status status) {
        return partitions.stream().mapToLong(p -> p.count(status)).sum();
    }

    /** Jobs whose artifact was written by this run. */
    public List<JobReport> produced() {
        return reports().stream()
                .filter(r -> r.status() == JobReport.Status.COMPLETED)
                .toList();
    }
}
