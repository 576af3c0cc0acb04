package dev.opcycle.planner;

import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.HealthStatus;
import dev.opcycle.planner.model.Issue;
import dev.opcycle.planner.model.IssueKind;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.LifecycleInfo;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.PlatformVersion;
import dev.opcycle.planner.paths.DurationEstimator;
import dev.opcycle.planner.paths.FixedOffsetSupportHorizon;
import dev.opcycle.planner.paths.PathAssembler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Builders for snapshots used across the planner tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2026-01-15T00:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {
    }

    public static ComponentInstallation installation(String name, String version, String channel) {
        return new ComponentInstallation(name, "operators", name + " Operator", name, version, channel,
                "redhat-operators", "openshift-marketplace", NOW, NOW, true);
    }

    public static AvailableUpgrade upgrade(String name, String current, String target, String channel) {
        return new AvailableUpgrade(name, current, target, channel, false, List.of(),
                LifecycleInfo.defaults(name, target));
    }

    public static Issue issue(String component, IssueSeverity severity, IssueKind kind) {
        return new Issue(component + "-" + kind.name().toLowerCase(), component, severity, kind,
                "title", "description", "recommendation", severity == IssueSeverity.CRITICAL, NOW);
    }

    public static ComponentStatus component(
            String name, String version, List<AvailableUpgrade> upgrades, Issue... issues) {
        var installation = installation(name, version, "stable");
        var issueList = Arrays.asList(issues);
        return new ComponentStatus(installation, LifecycleInfo.defaults(name, version), upgrades,
                Channel.placeholder("stable", version), List.of(), issueList, HealthStatus.of(issueList));
    }

    public static PlatformVersion platform(String current, String... updates) {
        return new PlatformVersion(current, current, "stable-4.15", List.of(updates), false, null, null, null);
    }

    public static PlatformSnapshot snapshot(PlatformVersion platform, ComponentStatus... components) {
        return snapshot(platform, null, components);
    }

    public static PlatformSnapshot snapshot(
            PlatformVersion platform, Integer supportExpiresIn, ComponentStatus... components) {
        var list = List.of(components);
        int critical = (int) list.stream().flatMap(c -> c.issues().stream())
                .filter(i -> i.severity() == IssueSeverity.CRITICAL)
                .count();
        int total = list.stream().mapToInt(c -> c.issues().size()).sum();
        var health = critical > 0 ? HealthStatus.CRITICAL : total > 0 ? HealthStatus.WARNING : HealthStatus.HEALTHY;
        return new PlatformSnapshot(platform, list, health, total, critical, supportExpiresIn, List.of(), NOW);
    }

    public static PathAssembler assembler() {
        return new PathAssembler(new DurationEstimator(), new FixedOffsetSupportHorizon(CLOCK, 18));
    }
}
