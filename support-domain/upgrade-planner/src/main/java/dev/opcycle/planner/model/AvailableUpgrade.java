package dev.opcycle.planner.model;

import java.util.List;

/**
 * A newer channel head a component could move to, with the lifecycle of that target.
 */
public record AvailableUpgrade(
        String componentName,
        String currentVersion,
        String targetVersion,
        String channel,
        boolean requiresIntermediateUpgrades,
        List<String> intermediateVersions,
        LifecycleInfo lifecycleInfo) {
}
