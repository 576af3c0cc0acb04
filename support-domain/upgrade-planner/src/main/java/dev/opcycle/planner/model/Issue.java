package dev.opcycle.planner.model;

import java.time.Instant;

/**
 * A risk detected for one component. The id is stable for a given component and issue kind.
 */
public record Issue(
        String id,
        String componentName,
        IssueSeverity severity,
        IssueKind kind,
        String title,
        String description,
        String recommendation,
        boolean affectsPlatformUpgrade,
        Instant detectedAt) {
}
