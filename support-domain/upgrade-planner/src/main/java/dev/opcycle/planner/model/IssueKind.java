package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category of a detected component issue.
 */
public enum IssueKind {
    @JsonProperty("version-ceiling") VERSION_CEILING,
    @JsonProperty("stale-channel") STALE_CHANNEL,
    @JsonProperty("outdated-version") OUTDATED_VERSION,
    @JsonProperty("lifecycle-expiring") LIFECYCLE_EXPIRING,
    @JsonProperty("incompatible-cluster") INCOMPATIBLE_CLUSTER
}
