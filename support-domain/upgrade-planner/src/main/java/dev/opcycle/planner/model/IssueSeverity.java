package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum IssueSeverity {
    /** Blocks platform operations or upgrades. */
    @JsonProperty("critical") CRITICAL,
    @JsonProperty("warning") WARNING,
    @JsonProperty("info") INFO
}
