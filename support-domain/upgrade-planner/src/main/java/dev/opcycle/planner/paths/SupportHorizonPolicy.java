package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradeStep;

import java.time.Instant;
import java.util.List;

/**
 * Estimates until when the platform stays supported once a path has been applied.
 */
public interface SupportHorizonPolicy {

    Instant estimateSupportedUntil(PlatformSnapshot snapshot, List<UpgradeStep> steps);
}
