package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How safe a strategy considers its path.
 */
public enum Confidence {
    @JsonProperty("high") HIGH,
    @JsonProperty("medium") MEDIUM,
    @JsonProperty("low") LOW
}
