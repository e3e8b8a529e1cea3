package com.genbatch.orchestrator.progress;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Ledger record of one job identity, as stored in progress.json.
 *
 * @param durationSeconds wall time of the last attempt sequence, one decimal
 * @param files           artifact paths relative to the output directory (completed only)
 * @param error           failure reason, at most {@link ProgressLedger#MAX_ERROR_LENGTH} chars
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProgressEntry(
        ProgressStatus status,
        String character,
        String scene,
        String workflow,
        Instant started,
        Instant finished,
        @JsonProperty("duration_s") Double durationSeconds,
        List<String> files,
        String error) {

    public boolean is(ProgressStatus s) {
        return status == s;
    }
}
