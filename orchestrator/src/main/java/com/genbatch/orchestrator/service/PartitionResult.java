package com.genbatch.orchestrator.service;

import com.genbatch.orchestrator.execution.JobReport;
import com.genbatch.orchestrator.model.Job;
import com.genbatch.orchestrator.model.WorkerContext;

import java.util.List;

/**
 * Outcome of one worker loop.
 *
 * @param reports    one per job that was looked at, in order
 * @param fatalError why the loop stopped early; null if it ran to the end
 * @param abandoned  jobs never attempted because the loop stopped early
 */
public record PartitionResult(WorkerContext context, List<JobReport> reports,
                              String fatalError, List<Job> abandoned) {

    public PartitionResult {
        reports   = List.copyOf(reports);
        abandoned = List.copyOf(abandoned);
    }

    public boolean isFatal() {
        return fatalError != null;
    }

    public long count(JobReport.Status status) {
        return reports.stream().filter(r -> r.status() == status).count();
    }
}
