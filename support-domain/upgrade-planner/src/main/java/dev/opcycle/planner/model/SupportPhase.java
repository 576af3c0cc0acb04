package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Vendor support phase of a component version.
 */
public enum SupportPhase {
    @JsonProperty("full-support") FULL_SUPPORT,
    @JsonProperty("maintenance-support") MAINTENANCE_SUPPORT,
    @JsonProperty("end-of-life") END_OF_LIFE,
    @JsonProperty("deprecated") DEPRECATED,
    @JsonProperty("unknown") UNKNOWN
}
