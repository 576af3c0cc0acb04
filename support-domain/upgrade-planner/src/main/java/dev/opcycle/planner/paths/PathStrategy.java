package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradePath;

import java.util.Optional;

/**
 * One way of trading risk against currency. Strategies share no state and may run concurrently.
 */
public interface PathStrategy {

    String id();

    /**
     * The proposed path, or empty when the strategy has nothing to change.
     */
    Optional<UpgradePath> generate(PlatformSnapshot snapshot);
}
