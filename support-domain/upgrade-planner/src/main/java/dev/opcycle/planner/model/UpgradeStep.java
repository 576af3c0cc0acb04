package dev.opcycle.planner.model;

import java.util.List;

/**
 * One step of an upgrade path. Version and channel fields are {@code null} for verification steps.
 */
public record UpgradeStep(
        int order,
        StepKind kind,
        String target,
        String fromVersion,
        String toVersion,
        String channel,
        String description,
        DurationEstimate estimatedDuration,
        List<String> requiredPrerequisites,
        String rollbackStrategy) {
}
