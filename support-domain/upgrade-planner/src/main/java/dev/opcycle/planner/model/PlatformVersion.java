package dev.opcycle.planner.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Version and update track of the platform itself.
 *
 * @param availableUpdates ordered by release: the first entry is the next update, the last one the newest
 */
public record PlatformVersion(
        String currentVersion,
        String desiredVersion,
        String channel,
        List<String> availableUpdates,
        boolean eus,
        Instant fullSupportEndsAt,
        Instant maintenanceSupportEndsAt,
        Instant endOfLifeAt) {

    public Optional<String> nextUpdate() {
        return availableUpdates.isEmpty() ? Optional.empty() : Optional.of(availableUpdates.get(0));
    }

    public Optional<String> latestUpdate() {
        return availableUpdates.isEmpty()
                ? Optional.empty()
                : Optional.of(availableUpdates.get(availableUpdates.size() - 1));
    }

    public PlatformVersion withSupportDates(Instant fullSupportEnds, Instant maintenanceSupportEnds, Instant eol) {
        return new PlatformVersion(currentVersion, desiredVersion, channel, availableUpdates, eus,
                fullSupportEnds, maintenanceSupportEnds, eol);
    }
}
