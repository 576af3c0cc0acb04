package dev.opcycle.planner.model;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the platform and every component that could be inspected.
 *
 * @param supportExpiresIn   days until the earliest maintenance-support end, {@code null} when no date is known
 * @param omittedComponents  components whose details could not be gathered for this snapshot
 */
public record PlatformSnapshot(
        PlatformVersion platform,
        List<ComponentStatus> components,
        HealthStatus overallHealth,
        int totalIssues,
        int criticalIssues,
        Integer supportExpiresIn,
        List<String> omittedComponents,
        Instant takenAt) {
}
