package dev.opcycle.planner.model;

import java.time.Instant;
import java.util.List;

/**
 * Proposed date for applying an upgrade path, with its priority and reason.
 */
public record MaintenanceWindow(
        String id,
        Instant recommendedDate,
        Priority priority,
        String reason,
        List<String> affectedComponents,
        String estimatedDuration,
        UpgradePath upgradePath) {
}
