package dev.opcycle.planner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Health of a component or of the whole platform, derived from its issues.
 */
public enum HealthStatus {
    @JsonProperty("healthy") HEALTHY,
    @JsonProperty("warning") WARNING,
    @JsonProperty("critical") CRITICAL;

    public static HealthStatus of(List<Issue> issues) {
        if (issues.stream().anyMatch(issue -> issue.severity() == IssueSeverity.CRITICAL)) {
            return CRITICAL;
        }
        if (issues.stream().anyMatch(issue -> issue.severity() == IssueSeverity.WARNING)) {
            return WARNING;
        }
        return HEALTHY;
    }
}
