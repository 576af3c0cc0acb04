package dev.opcycle.planner.lifecycle;

import java.time.Instant;

/**
 * Support dates of a platform release stream such as {@code 4.15}.
 */
public record PlatformLifecycle(
        String version,
        Instant fullSupportEndsAt,
        Instant maintenanceSupportEndsAt,
        Instant endOfLifeAt) {
}
