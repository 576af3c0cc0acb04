package dev.opcycle.planner.issues;

import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.model.Issue;
import dev.opcycle.planner.model.IssueKind;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.LifecycleInfo;
import dev.opcycle.planner.model.PlatformVersion;
import dev.opcycle.planner.model.SupportPhase;
import dev.opcycle.planner.version.Versions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects upgrade risks for a single component.
 * <p>
 * Checks run in a fixed order (stale channel, maintenance support, end of life, version ceiling) so the
 * resulting list is deterministic. Missing or unparsable data skips a check instead of raising an issue.
 */
@ApplicationScoped
public class IssueDetector {

    private final Clock clock;

    @Inject
    public IssueDetector(Clock clock) {
        this.clock = clock;
    }

    public List<Issue> detect(
            ComponentInstallation installation,
            LifecycleInfo lifecycle,
            Channel currentChannel,
            PlatformVersion platform) {
        List<Issue> issues = new ArrayList<>();
        var name = installation.name();

        if (currentChannel != null && currentChannel.deprecated()) {
            issues.add(issue(name, "stale-channel", IssueSeverity.WARNING, IssueKind.STALE_CHANNEL,
                    "Channel is deprecated",
                    currentChannel.deprecationMessage() != null
                            ? currentChannel.deprecationMessage()
                            : "The current subscription channel has been deprecated.",
                    "Switch to a supported channel: " + currentChannel.name(),
                    false));
        }

        if (lifecycle.supportPhase() == SupportPhase.MAINTENANCE_SUPPORT) {
            issues.add(issue(name, "maintenance", IssueSeverity.WARNING, IssueKind.LIFECYCLE_EXPIRING,
                    "Operator in maintenance support",
                    "This operator version is in maintenance support phase.",
                    "Plan an upgrade to a version in full support.",
                    false));
        }

        if (lifecycle.supportPhase() == SupportPhase.END_OF_LIFE) {
            issues.add(issue(name, "eol", IssueSeverity.CRITICAL, IssueKind.LIFECYCLE_EXPIRING,
                    "Operator end of life",
                    "This operator version has reached end of life.",
                    "Upgrade immediately to a supported version.",
                    true));
        }

        if (blocksNextPlatformUpdate(lifecycle, platform)) {
            var nextVersion = Versions.clean(platform.nextUpdate().orElseThrow());
            issues.add(issue(name, "version-ceiling", IssueSeverity.CRITICAL, IssueKind.VERSION_CEILING,
                    "Operator blocks cluster upgrade",
                    "This operator version does not support OCP " + nextVersion
                            + ". Max supported: " + lifecycle.maxPlatformVersion(),
                    "Upgrade operator to a version compatible with OCP " + nextVersion
                            + " before upgrading the cluster.",
                    true));
        }

        return List.copyOf(issues);
    }

    /**
     * Whether the component's declared maximum platform version is below the platform's next update.
     * Returns {@code false} whenever either version is missing or cannot be compared.
     */
    public boolean blocksNextPlatformUpdate(LifecycleInfo lifecycle, PlatformVersion platform) {
        if (lifecycle.maxPlatformVersion() == null || platform == null) {
            return false;
        }
        return platform.nextUpdate()
                .map(next -> Versions.isGreater(next, lifecycle.maxPlatformVersion()))
                .orElse(false);
    }

    private Issue issue(
            String component,
            String suffix,
            IssueSeverity severity,
            IssueKind kind,
            String title,
            String description,
            String recommendation,
            boolean affectsPlatformUpgrade) {
        return new Issue(component + "-" + suffix, component, severity, kind, title, description, recommendation,
                affectsPlatformUpgrade, clock.instant());
    }
}
