package dev.opcycle.planner.lifecycle;

import dev.opcycle.planner.model.LifecycleInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Cached lifecycle lookups. Provider failures degrade to {@link LifecycleInfo#defaults}, which never adds urgency.
 */
@ApplicationScoped
public class LifecycleService {

    private static final Logger LOG = Logger.getLogger(LifecycleService.class);

    private final LifecycleMetadataProvider provider;
    private final LifecycleCache cache;

    @Inject
    public LifecycleService(LifecycleMetadataProvider provider, LifecycleCache cache) {
        this.provider = provider;
        this.cache = cache;
    }

    public LifecycleInfo componentLifecycle(String componentName, String version) {
        var cached = cache.get(componentName, version);
        if (cached.isPresent()) {
            return cached.get();
        }
        try {
            var info = provider.componentLifecycle(componentName, version);
            cache.put(componentName, version, info);
            return info;
        } catch (LifecycleLookupException e) {
            LOG.warnf("Failed to fetch lifecycle info for %s %s, using defaults: %s",
                    componentName, version, e.getMessage());
            return LifecycleInfo.defaults(componentName, version);
        }
    }

    public Optional<PlatformLifecycle> platformLifecycle(String platformVersion) {
        try {
            return provider.platformLifecycle(platformVersion);
        } catch (LifecycleLookupException e) {
            LOG.warnf("Failed to fetch platform lifecycle for %s: %s", platformVersion, e.getMessage());
            return Optional.empty();
        }
    }
}
