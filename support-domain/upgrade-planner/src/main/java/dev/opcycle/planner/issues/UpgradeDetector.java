package dev.opcycle.planner.issues;

import dev.opcycle.planner.lifecycle.LifecycleService;
import dev.opcycle.planner.model.AvailableUpgrade;
import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.version.Versions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the channel heads that are newer than what a component currently runs.
 */
@ApplicationScoped
public class UpgradeDetector {

    private final LifecycleService lifecycleService;

    @Inject
    public UpgradeDetector(LifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    /**
     * One candidate per channel whose current version is strictly greater than the installed one, in channel
     * order. Channels whose version cannot be compared are skipped.
     */
    public List<AvailableUpgrade> detect(ComponentInstallation installation, List<Channel> channels) {
        List<AvailableUpgrade> upgrades = new ArrayList<>();
        for (Channel channel : channels) {
            if (!Versions.isGreater(channel.currentVersion(), installation.currentVersion())) {
                continue;
            }
            var targetLifecycle = lifecycleService.componentLifecycle(
                    installation.name(), Versions.clean(channel.currentVersion()));
            upgrades.add(new AvailableUpgrade(
                    installation.name(),
                    installation.currentVersion(),
                    channel.currentVersion(),
                    channel.name(),
                    false,
                    List.of(),
                    targetLifecycle));
        }
        return List.copyOf(upgrades);
    }
}
