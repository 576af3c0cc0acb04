package dev.opcycle.planner.lifecycle;

import dev.opcycle.planner.model.LifecycleInfo;

import java.util.Optional;

/**
 * Source of support lifecycle facts. Implementations may call a remote service; callers cache the answers.
 */
public interface LifecycleMetadataProvider {

    /**
     * @throws LifecycleLookupException when the source cannot be consulted
     */
    LifecycleInfo componentLifecycle(String componentName, String version);

    /**
     * @throws LifecycleLookupException when the source cannot be consulted
     */
    Optional<PlatformLifecycle> platformLifecycle(String platformVersion);
}
