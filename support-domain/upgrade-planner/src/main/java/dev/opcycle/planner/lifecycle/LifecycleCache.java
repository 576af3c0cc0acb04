package dev.opcycle.planner.lifecycle;

import dev.opcycle.planner.model.LifecycleInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lifecycle lookups keyed by {@code component:version}, each entry expiring after the configured TTL.
 */
@ApplicationScoped
public class LifecycleCache {

    private final Clock clock;
    private final Duration ttl;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @Inject
    public LifecycleCache(Clock clock, @ConfigProperty(name = "planner.lifecycle.cache-ttl") Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<LifecycleInfo> get(String componentName, String version) {
        var key = key(componentName, version);
        var entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.info());
    }

    public void put(String componentName, String version, LifecycleInfo info) {
        if (ttl.isNegative() || ttl.isZero()) {
            return;
        }
        entries.put(key(componentName, version), new Entry(info, clock.instant().plus(ttl)));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private static String key(String componentName, String version) {
        return componentName + ":" + version;
    }

    private record Entry(LifecycleInfo info, Instant expiresAt) {
    }
}
