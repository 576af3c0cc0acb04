package dev.opcycle.planner.model;

import java.util.List;

/**
 * One installed component with its lifecycle, channels, upgrade candidates and detected issues.
 */
public record ComponentStatus(
        ComponentInstallation installation,
        LifecycleInfo lifecycleInfo,
        List<AvailableUpgrade> availableUpgrades,
        Channel currentChannel,
        List<Channel> availableChannels,
        List<Issue> issues,
        HealthStatus healthStatus) {

    public boolean hasIssue(IssueSeverity severity) {
        return issues.stream().anyMatch(issue -> issue.severity() == severity);
    }

    public boolean hasUpgrades() {
        return !availableUpgrades.isEmpty();
    }
}
