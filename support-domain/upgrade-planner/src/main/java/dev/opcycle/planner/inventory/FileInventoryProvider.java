package dev.opcycle.planner.inventory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opcycle.planner.JsonNodes;
import dev.opcycle.planner.PlannerEvent;
import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.model.PlatformVersion;
import dev.opcycle.planner.version.Versions;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
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
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the inventory export (cluster version, subscriptions and package manifests) from a JSON file.
 */
@ApplicationScoped
public class FileInventoryProvider implements InventoryProvider {

    private static final Logger LOG = Logger.getLogger(FileInventoryProvider.class);
    private static final String UNKNOWN = "unknown";
    private static final String OCP_VERSIONS_ANNOTATION = "com.redhat.openshift.versions";

    private final ObjectMapper mapper;
    private final Path inventoryPath;
    private final Duration refreshInterval;
    private final Event<PlannerEvent> events;
    private final AtomicReference<InventoryDocument> document = new AtomicReference<>(InventoryDocument.EMPTY);
    private volatile FileTime lastLoaded = FileTime.from(Instant.EPOCH);

    @Inject
    public FileInventoryProvider(
            ObjectMapper mapper,
            @ConfigProperty(name = "planner.inventory-path") String inventoryPath,
            @ConfigProperty(name = "planner.inventory-refresh-interval") Duration refreshInterval,
            Event<PlannerEvent> events) {
        this.mapper = mapper;
        this.inventoryPath = Path.of(inventoryPath);
        this.refreshInterval = refreshInterval;
        this.events = events;
    }

    void onStartup(@Observes StartupEvent event) {
        try {
            refresh();
        } catch (UncheckedIOException e) {
            LOG.errorf("Inventory %s could not be loaded at startup: %s", inventoryPath, e.getMessage());
        }
    }

    @Scheduled(every = "2s")
    void watchForChanges() {
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            return;
        }
        try {
            var now = Instant.now();
            var nextRefresh = lastLoaded.toInstant().plus(refreshInterval);
            if (now.isBefore(nextRefresh)) {
                return;
            }
            boolean exists = Files.exists(inventoryPath);
            var fileTime = exists
                    ? Files.getLastModifiedTime(inventoryPath)
                    : FileTime.from(Instant.EPOCH);
            if (!exists || fileTime.toInstant().isAfter(lastLoaded.toInstant())) {
                refresh();
            }
        } catch (IOException | UncheckedIOException e) {
            events.fire(PlannerEvent.warning("Could not watch the inventory file: " + e.getMessage()));
        }
    }

    @Override
    public PlatformVersion fetchPlatformVersion() {
        var clusterVersion = document.get().clusterVersion();
        if (clusterVersion == null || !clusterVersion.isObject()) {
            throw new InventoryException("Inventory " + inventoryPath + " has no cluster version");
        }
        var status = clusterVersion.path("status");
        var version = JsonNodes.text(status.path("desired").path("version"), UNKNOWN);
        var channel = JsonNodes.text(clusterVersion.path("spec").path("channel"), UNKNOWN);
        List<String> updates = new ArrayList<>();
        for (JsonNode update : JsonNodes.elements(status.path("availableUpdates"))) {
            var updateVersion = update.isObject() ? JsonNodes.text(update.path("version"), null) : JsonNodes.text(update, null);
            if (updateVersion != null) {
                updates.add(updateVersion);
            }
        }
        return new PlatformVersion(version, version, channel, ascending(updates), channel.contains("eus"),
                null, null, null);
    }

    /**
     * Oldest update first. Entries without a comparable version go last, in file order.
     */
    private List<String> ascending(List<String> updates) {
        List<String> comparable = new ArrayList<>();
        List<String> opaque = new ArrayList<>();
        for (String update : updates) {
            if (Versions.isValid(update)) {
                comparable.add(update);
            } else {
                LOG.warnf("Platform update %s has no comparable version, listing it last", update);
                opaque.add(update);
            }
        }
        comparable.sort(Comparator.comparing(update -> Versions.parse(update).orElseThrow()));
        comparable.addAll(opaque);
        return List.copyOf(comparable);
    }

    @Override
    public List<ComponentInstallation> listInstallations() {
        return document.get().installations();
    }

    @Override
    public Optional<ComponentInstallation> findInstallation(String namespace, String name) {
        return listInstallations().stream()
                .filter(installation -> installation.namespace().equals(namespace) && installation.name().equals(name))
                .findFirst();
    }

    @Override
    public List<Channel> fetchChannels(ComponentInstallation installation) {
        var manifest = document.get().packageManifests().stream()
                .filter(node -> installation.packageName().equals(JsonNodes.text(node.path("metadata").path("name"), null)))
                .filter(node -> UNKNOWN.equals(installation.catalogNamespace())
                        || installation.catalogNamespace().equals(JsonNodes.text(node.path("metadata").path("namespace"), null)))
                .findFirst();
        if (manifest.isEmpty()) {
            LOG.warnf("PackageManifest %s not found in catalog %s", installation.packageName(), installation.catalogSource());
            return List.of();
        }

        var channelsNode = manifest.get().path("status").path("channels");
        if (!channelsNode.isMissingNode() && !channelsNode.isNull() && !channelsNode.isArray()) {
            throw new InventoryException("Malformed channel list in package " + installation.packageName());
        }
        List<Channel> channels = new ArrayList<>();
        for (JsonNode node : JsonNodes.elements(channelsNode)) {
            var name = JsonNodes.text(node.path("name"), null);
            if (name == null) {
                throw new InventoryException("Channel without a name in package " + installation.packageName());
            }
            List<String> versions = new ArrayList<>();
            JsonNodes.elements(node.path("entries")).forEach(entry -> {
                var version = JsonNodes.text(entry.path("version"), null);
                if (version != null) {
                    versions.add(version);
                }
            });
            var deprecationMessage = JsonNodes.text(node.path("deprecation").path("message"), null);
            channels.add(new Channel(
                    name,
                    JsonNodes.text(node.path("currentCSV"), null),
                    List.copyOf(versions),
                    deprecationMessage != null,
                    deprecationMessage,
                    platformVersions(node)));
        }
        return List.copyOf(channels);
    }

    synchronized void refresh() {
        try {
            var loaded = readFromFile();
            document.set(loaded);
            lastLoaded = Files.exists(inventoryPath)
                    ? Files.getLastModifiedTime(inventoryPath)
                    : FileTime.from(Instant.now());
            events.fire(PlannerEvent.inventoryReloaded(loaded.installations().size()));
        } catch (IOException e) {
            events.fire(PlannerEvent.warning("Could not refresh the inventory: " + e.getMessage()));
            throw new UncheckedIOException("Unable to read " + inventoryPath, e);
        }
    }

    private InventoryDocument readFromFile() throws IOException {
        if (!Files.exists(inventoryPath)) {
            return InventoryDocument.EMPTY;
        }

        try (var reader = Files.newBufferedReader(inventoryPath)) {
            JsonNode root = mapper.readTree(reader);
            List<ComponentInstallation> installations = new ArrayList<>();
            for (JsonNode subscription : JsonNodes.elements(root.path("subscriptions"))) {
                var installation = toInstallation(subscription);
                if (installation != null) {
                    installations.add(installation);
                }
            }
            var clusterVersion = root.hasNonNull("clusterVersion") ? root.get("clusterVersion") : null;
            return new InventoryDocument(
                    clusterVersion,
                    List.copyOf(installations),
                    JsonNodes.elements(root.path("packageManifests")));
        }
    }

    private ComponentInstallation toInstallation(JsonNode subscription) {
        var metadata = subscription.path("metadata");
        var spec = subscription.path("spec");
        var status = subscription.path("status");
        var name = JsonNodes.text(metadata.path("name"), null);
        if (name == null) {
            LOG.warnf("Skipping subscription without a name: %s", subscription);
            return null;
        }
        var packageName = JsonNodes.text(spec.path("name"), name);
        var installedAt = safeInstant(metadata.path("creationTimestamp"), name);
        var updatedAt = status.hasNonNull("lastUpdated") ? safeInstant(status.path("lastUpdated"), name) : installedAt;
        return new ComponentInstallation(
                name,
                JsonNodes.text(metadata.path("namespace"), "default"),
                packageName,
                packageName,
                JsonNodes.text(status.path("currentCSV"), UNKNOWN),
                JsonNodes.text(spec.path("channel"), UNKNOWN),
                JsonNodes.text(spec.path("source"), UNKNOWN),
                JsonNodes.text(spec.path("sourceNamespace"), UNKNOWN),
                installedAt,
                updatedAt,
                "Automatic".equals(spec.path("installPlanApproval").asText()));
    }

    private Instant safeInstant(JsonNode node, String subscription) {
        try {
            return JsonNodes.instant(node);
        } catch (DateTimeParseException e) {
            LOG.debugf("Ignoring malformed timestamp on subscription %s: %s", subscription, node.asText());
            return null;
        }
    }

    private List<String> platformVersions(JsonNode channel) {
        var annotation = JsonNodes.text(
                channel.path("currentCSVDesc").path("annotations").path(OCP_VERSIONS_ANNOTATION), null);
        if (annotation == null) {
            return null;
        }
        return Arrays.stream(annotation.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .toList();
    }

    private record InventoryDocument(
            JsonNode clusterVersion,
            List<ComponentInstallation> installations,
            List<JsonNode> packageManifests) {
        static final InventoryDocument EMPTY = new InventoryDocument(null, List.of(), List.of());
    }
}
