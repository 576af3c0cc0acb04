package dev.opcycle.planner.model;

import java.time.Instant;
import java.util.List;

/**
 * Everything produced for one recommendation request.
 */
public record RecommendationBundle(
        PlatformSnapshot platformStatus,
        List<UpgradePath> recommendedPaths,
        List<MaintenanceWindow> maintenanceWindows,
        Instant generatedAt) {
}
