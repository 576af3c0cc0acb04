package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.Confidence;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.version.Versions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Upgrades components that have issues or drifted by a minor version or more, preferring stable channels,
 * and moves the platform to its next update.
 */
@ApplicationScoped
public class BalancedStrategy implements PathStrategy {

    public static final String ID = "balanced-path";

    private static final List<String> STABLE_MARKERS = List.of("stable", "recommended");

    private final PathAssembler assembler;

    @Inject
    public BalancedStrategy(PathAssembler assembler) {
        this.assembler = assembler;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Optional<UpgradePath> generate(PlatformSnapshot snapshot) {
        List<ComponentStatus> qualifying = snapshot.components().stream()
                .filter(component -> !component.issues().isEmpty() || isSignificantlyOutdated(component))
                .toList();
        if (qualifying.isEmpty()) {
            return Optional.empty();
        }

        var sequence = StepSequence.verifiedBy("Verify cluster health and backup", List.of("Cluster backup"));
        for (ComponentStatus component : qualifying) {
            findBalancedUpgrade(component).ifPresent(upgrade -> sequence.component(component, upgrade,
                    "Upgrade " + component.installation().displayName() + " to recommended version",
                    List.of("Review release notes"),
                    "Reinstall previous version"));
        }

        var platform = snapshot.platform();
        platform.nextUpdate().ifPresent(next -> sequence.platform(platform, next,
                "Upgrade OpenShift to " + next,
                List.of("All operators compatible", "Cluster health verified"),
                "Not supported"));

        return assembler.assemble(ID,
                "Optimal balance of risk, effort, and support duration",
                Confidence.HIGH,
                snapshot,
                sequence,
                List.of("Good balance of risk and reward", "Addresses key issues", "Reasonable maintenance window",
                        "Extended support period"),
                List.of("Some operator updates required", "Moderate testing effort"));
    }

    /**
     * Patch-only drift does not count. Unparsable versions never count.
     */
    static boolean isSignificantlyOutdated(ComponentStatus component) {
        return AggressiveStrategy.latestUpgrade(component)
                .map(furthest -> Versions.diff(component.installation().currentVersion(), furthest.targetVersion())
                        .atLeastMinor())
                .orElse(false);
    }

    /**
     * The last upgrade on a stable or recommended channel, otherwise the middle one by list position.
     */
    static Optional<AvailableUpgrade> findBalancedUpgrade(ComponentStatus component) {
        var upgrades = component.availableUpgrades();
        if (upgrades.isEmpty()) {
            return Optional.empty();
        }
        var stable = upgrades.stream()
                .filter(upgrade -> upgrade.channel() != null
                        && STABLE_MARKERS.stream().anyMatch(upgrade.channel()::contains))
                .toList();
        if (!stable.isEmpty()) {
            return Optional.of(stable.get(stable.size() - 1));
        }
        return Optional.of(upgrades.get(upgrades.size() / 2));
    }
}
