package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Urgency of a maintenance window.
 */
public enum Priority {
    @JsonProperty("high") HIGH,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("low") LOW
}
