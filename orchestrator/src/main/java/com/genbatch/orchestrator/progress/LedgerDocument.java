package com.genbatch.orchestrator.progress;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/** On-disk shape of progress.json. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerDocument(
        Instant started,
        Map<String, ProgressEntry> jobs,
        Instant finished,
        Summary summary) {

    public record Summary(int total, int completed, int failed, int skipped) {}
}
