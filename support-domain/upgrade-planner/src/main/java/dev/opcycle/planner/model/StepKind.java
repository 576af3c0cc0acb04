package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What an upgrade step acts on.
 */
public enum StepKind {
    @JsonProperty("verification") VERIFICATION,
    @JsonProperty("component") COMPONENT,
    @JsonProperty("platform") PLATFORM
}
