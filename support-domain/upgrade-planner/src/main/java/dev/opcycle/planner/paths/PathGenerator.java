package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.List;
import java.util.Optional;

/**
 * Runs the strategies in a fixed order: critical issues, conservative, aggressive, balanced.
 */
@ApplicationScoped
public class PathGenerator {

    private final List<PathStrategy> strategies;

    @Inject
    public PathGenerator(
            CriticalIssuesStrategy critical,
            ConservativeStrategy conservative,
            AggressiveStrategy aggressive,
            BalancedStrategy balanced) {
        this.strategies = List.of(critical, conservative, aggressive, balanced);
    }

    public List<UpgradePath> generate(PlatformSnapshot snapshot) {
        return strategies.stream()
                .map(strategy -> strategy.generate(snapshot))
                .flatMap(Optional::stream)
                .toList();
    }
}
