package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a component's support lifetime relates to the platform release cadence.
 */
public enum LifecycleModel {
    @JsonProperty("platform-aligned") PLATFORM_ALIGNED,
    @JsonProperty("platform-agnostic") PLATFORM_AGNOSTIC,
    @JsonProperty("rolling-release") ROLLING_RELEASE,
    @JsonProperty("unknown") UNKNOWN
}
