package com.genbatch.orchestrator.progress;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProgressStatus {
    @JsonProperty("in_progress") IN_PROGRESS,
    @JsonProperty("completed")   COMPLETED,
    @JsonProperty("failed")      FAILED
}
