package dev.opcycle.planner.lifecycle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opcycle.planner.JsonNodes;
import dev.opcycle.planner.PlannerEvent;
import dev.opcycle.planner.model.LifecycleInfo;
import dev.opcycle.planner.model.LifecycleModel;
import dev.opcycle.planner.model.SupportPhase;
import dev.opcycle.planner.version.Versions;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Static lifecycle metadata read from a JSON file, with naming-pattern defaults for anything not listed.
 */
@ApplicationScoped
public class FileLifecycleCatalog implements LifecycleMetadataProvider {

    private static final Logger LOG = Logger.getLogger(FileLifecycleCatalog.class);

    private final ObjectMapper mapper;
    private final Optional<Path> lifecyclePath;
    private final Event<PlannerEvent> events;
    private final AtomicReference<Entries> entries = new AtomicReference<>(Entries.EMPTY);
    private volatile String loadFailure;

    @Inject
    public FileLifecycleCatalog(
            ObjectMapper mapper,
            @ConfigProperty(name = "planner.lifecycle-path") Optional<String> lifecyclePath,
            Event<PlannerEvent> events) {
        this.mapper = mapper;
        this.lifecyclePath = lifecyclePath.map(Path::of);
        this.events = events;
    }

    void onStartup(@Observes StartupEvent event) {
        try {
            refresh();
        } catch (UncheckedIOException e) {
            LOG.warnf("Lifecycle metadata unavailable, lookups will use defaults: %s", e.getMessage());
        }
    }

    @Override
    public LifecycleInfo componentLifecycle(String componentName, String version) {
        failIfUnavailable();
        return entries.get().components().stream()
                .filter(entry -> entry.name().equals(componentName) && matchesVersion(entry.version(), version))
                .max(Comparator.comparingInt(entry -> entry.version().length()))
                .map(entry -> entry.toInfo(componentName, version))
                .orElseGet(() -> LifecycleDefaults.forComponent(componentName, version));
    }

    @Override
    public Optional<PlatformLifecycle> platformLifecycle(String platformVersion) {
        failIfUnavailable();
        return entries.get().platform().stream()
                .filter(entry -> matchesVersion(entry.version(), platformVersion))
                .max(Comparator.comparingInt(entry -> entry.version().length()));
    }

    synchronized void refresh() {
        if (lifecyclePath.isEmpty() || !Files.exists(lifecyclePath.get())) {
            entries.set(Entries.EMPTY);
            loadFailure = null;
            return;
        }
        try (var reader = Files.newBufferedReader(lifecyclePath.get())) {
            var loaded = read(mapper.readTree(reader));
            entries.set(loaded);
            loadFailure = null;
            LOG.debugf("Loaded lifecycle metadata for %d component versions", loaded.components().size());
        } catch (IOException e) {
            loadFailure = e.getMessage();
            events.fire(PlannerEvent.warning("Could not read lifecycle metadata: " + e.getMessage()));
            throw new UncheckedIOException("Unable to read " + lifecyclePath.get(), e);
        }
    }

    private void failIfUnavailable() {
        var failure = loadFailure;
        if (failure != null) {
            throw new LifecycleLookupException("Lifecycle metadata could not be loaded: " + failure);
        }
    }

    private Entries read(JsonNode root) {
        List<ComponentEntry> components = new ArrayList<>();
        for (JsonNode node : JsonNodes.elements(root.path("components"))) {
            var name = JsonNodes.text(node.path("name"), null);
            var version = JsonNodes.text(node.path("version"), null);
            if (name == null || version == null) {
                LOG.warnf("Skipping lifecycle entry without name or version: %s", node);
                continue;
            }
            try {
                components.add(new ComponentEntry(name, version, new LifecycleInfo(
                        name,
                        version,
                        parseEnum(node.path("lifecycleModel"), LifecycleModel.class, LifecycleDefaults.modelFor(name)),
                        parseEnum(node.path("supportPhase"), SupportPhase.class, SupportPhase.FULL_SUPPORT),
                        JsonNodes.instant(node.path("fullSupportEndsAt")),
                        JsonNodes.instant(node.path("maintenanceSupportEndsAt")),
                        JsonNodes.instant(node.path("endOfLifeAt")),
                        JsonNodes.text(node.path("minPlatformVersion"), null),
                        JsonNodes.text(node.path("maxPlatformVersion"), null),
                        JsonNodes.text(node.path("recommendedForPlatformVersion"), null))));
            } catch (DateTimeParseException e) {
                LOG.warnf("Skipping lifecycle entry %s %s with malformed date: %s", name, version, e.getMessage());
            }
        }

        List<PlatformLifecycle> platform = new ArrayList<>();
        for (JsonNode node : JsonNodes.elements(root.path("platform"))) {
            var version = JsonNodes.text(node.path("version"), null);
            if (version == null) {
                continue;
            }
            try {
                platform.add(new PlatformLifecycle(
                        version,
                        JsonNodes.instant(node.path("fullSupportEndsAt")),
                        JsonNodes.instant(node.path("maintenanceSupportEndsAt")),
                        JsonNodes.instant(node.path("endOfLifeAt"))));
            } catch (DateTimeParseException e) {
                LOG.warnf("Skipping platform lifecycle entry %s with malformed date: %s", version, e.getMessage());
            }
        }
        return new Entries(List.copyOf(components), List.copyOf(platform));
    }

    private <E extends Enum<E>> E parseEnum(JsonNode node, Class<E> type, E fallback) {
        if (JsonNodes.text(node, null) == null) {
            return fallback;
        }
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            LOG.debugf("Unknown %s value %s", type.getSimpleName(), node.asText());
            return fallback;
        }
    }

    /**
     * {@code 1.10} matches {@code 1.10.3} and {@code operator.v1.10.3}, but not {@code 1.100.0}.
     */
    static boolean matchesVersion(String entryVersion, String version) {
        if (version == null) {
            return false;
        }
        var cleaned = Versions.clean(version);
        return cleaned.equals(entryVersion) || cleaned.startsWith(entryVersion + ".");
    }

    private record ComponentEntry(String name, String version, LifecycleInfo template) {
        LifecycleInfo toInfo(String componentName, String requestedVersion) {
            return new LifecycleInfo(componentName, requestedVersion, template.lifecycleModel(),
                    template.supportPhase(), template.fullSupportEndsAt(), template.maintenanceSupportEndsAt(),
                    template.endOfLifeAt(), template.minPlatformVersion(), template.maxPlatformVersion(),
                    template.recommendedForPlatformVersion());
        }
    }

    private record Entries(List<ComponentEntry> components, List<PlatformLifecycle> platform) {
        static final Entries EMPTY = new Entries(List.of(), List.of());
    }
}
