package dev.opcycle.planner.inventory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.opcycle.planner.RecordingEvents;
import dev.opcycle.planner.model.Channel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

class FileInventoryProviderTest {

    private static final String INVENTORY = """
            {
              "clusterVersion": {
                "spec": {"channel": "eus-4.14"},
                "status": {
                  "desired": {"version": "4.14.30"},
                  "availableUpdates": [{"version": "4.14.33"}, "4.15.2"]
                }
              },
              "subscriptions": [
                {
                  "metadata": {"name": "quay-operator", "namespace": "quay",
                               "creationTimestamp": "2024-01-10T12:00:00Z"},
                  "spec": {"name": "quay-operator", "channel": "stable-3.10", "source": "redhat-operators",
                           "sourceNamespace": "openshift-marketplace", "installPlanApproval": "Manual"},
                  "status": {"currentCSV": "quay-operator.v3.10.1", "lastUpdated": "not-a-date"}
                },
                {
                  "metadata": {"name": "bad-catalog", "namespace": "ops"},
                  "spec": {"name": "bad-catalog", "channel": "stable", "source": "community-operators",
                           "sourceNamespace": "openshift-marketplace"}
                },
                {
                  "metadata": {"name": "orphan", "namespace": "ops"},
                  "spec": {"name": "orphan", "sourceNamespace": "openshift-marketplace"}
                },
                {"metadata": {"namespace": "ops"}}
              ],
              "packageManifests": [
                {
                  "metadata": {"name": "quay-operator", "namespace": "other-marketplace"},
                  "status": {"channels": [{"name": "wrong-catalog"}]}
                },
                {
                  "metadata": {"name": "quay-operator", "namespace": "openshift-marketplace"},
                  "status": {"channels": [
                    {"name": "stable-3.10", "currentCSV": "quay-operator.v3.10.4",
                     "deprecation": {"message": "Use stable-3.11"},
                     "entries": [{"version": "3.10.4"}, {"version": "3.10.1"}]},
                    {"name": "stable-3.11", "currentCSV": "quay-operator.v3.11.0",
                     "currentCSVDesc": {"annotations": {"com.redhat.openshift.versions": "4.14, 4.15"}}}
                  ]}
                },
                {
                  "metadata": {"name": "bad-catalog", "namespace": "openshift-marketplace"},
                  "status": {"channels": {"name": "stable"}}
                }
              ]
            }
            """;

    @TempDir
    Path dir;

    private final RecordingEvents events = new RecordingEvents();

    @Test
    void readsPlatformVersionAndUpdates() throws IOException {
        var platform = provider(INVENTORY).fetchPlatformVersion();

        assertEquals("4.14.30", platform.currentVersion());
        assertEquals("eus-4.14", platform.channel());
        assertEquals(List.of("4.14.33", "4.15.2"), platform.availableUpdates());
        assertTrue(platform.eus());
        assertNull(platform.maintenanceSupportEndsAt());
    }

    @Test
    void platformUpdatesAreOrderedOldestFirst() throws IOException {
        var provider = provider("""
                {"clusterVersion": {
                  "spec": {"channel": "stable-4.16"},
                  "status": {
                    "desired": {"version": "4.15.12"},
                    "availableUpdates": [{"version": "4.16.5"}, {"version": "nightly"},
                                         {"version": "4.15.20"}, {"version": "4.16.1"}]
                  }
                }}
                """);

        var platform = provider.fetchPlatformVersion();

        assertEquals(List.of("4.15.20", "4.16.1", "4.16.5", "nightly"), platform.availableUpdates());
        assertEquals("4.15.20", platform.nextUpdate().orElseThrow());
    }

    @Test
    void readsSubscriptionsAndSkipsNamelessOnes() throws IOException {
        var provider = provider(INVENTORY);

        var installations = provider.listInstallations();
        assertEquals(List.of("quay-operator", "bad-catalog", "orphan"),
                installations.stream().map(i -> i.name()).toList());

        var quay = provider.findInstallation("quay", "quay-operator").orElseThrow();
        assertEquals("quay-operator.v3.10.1", quay.currentVersion());
        assertEquals("stable-3.10", quay.currentChannel());
        assertEquals(Instant.parse("2024-01-10T12:00:00Z"), quay.installedAt());
        assertNull(quay.updatedAt());
        assertFalse(quay.autoApproval());
        assertEquals("unknown", provider.findInstallation("ops", "orphan").orElseThrow().currentVersion());
        assertTrue(provider.findInstallation("quay", "orphan").isEmpty());
        assertEquals(List.of("INVENTORY_RELOADED"), events.types());
    }

    @Test
    void channelsComeFromTheSubscribedCatalog() throws IOException {
        var provider = provider(INVENTORY);
        var quay = provider.findInstallation("quay", "quay-operator").orElseThrow();

        var channels = provider.fetchChannels(quay);

        assertEquals(List.of("stable-3.10", "stable-3.11"), channels.stream().map(Channel::name).toList());
        var deprecated = channels.get(0);
        assertTrue(deprecated.deprecated());
        assertEquals("Use stable-3.11", deprecated.deprecationMessage());
        assertEquals(List.of("3.10.4", "3.10.1"), deprecated.availableVersions());
        assertEquals("quay-operator.v3.11.0", channels.get(1).currentVersion());
        assertEquals(List.of("4.14", "4.15"), channels.get(1).availablePlatformVersions());
    }

    @Test
    void unknownPackageHasNoChannels() throws IOException {
        var provider = provider(INVENTORY);

        assertTrue(provider.fetchChannels(provider.findInstallation("ops", "orphan").orElseThrow()).isEmpty());
    }

    @Test
    void malformedChannelListFails() throws IOException {
        var provider = provider(INVENTORY);
        var bad = provider.findInstallation("ops", "bad-catalog").orElseThrow();

        assertThrows(InventoryException.class, () -> provider.fetchChannels(bad));
    }

    @Test
    void missingClusterVersionFails() throws IOException {
        var provider = provider("{\"subscriptions\": []}");

        assertThrows(InventoryException.class, provider::fetchPlatformVersion);
    }

    @Test
    void missingFileIsAnEmptyInventory() {
        var provider = new FileInventoryProvider(new ObjectMapper(), dir.resolve("absent.json").toString(),
                Duration.ZERO, events);
        provider.refresh();

        assertTrue(provider.listInstallations().isEmpty());
        assertThrows(InventoryException.class, provider::fetchPlatformVersion);
    }

    @Test
    void deletedFileClearsInventoryOnNextWatch() throws IOException {
        var file = Files.writeString(dir.resolve("inventory.json"), INVENTORY);
        var provider = new FileInventoryProvider(new ObjectMapper(), file.toString(), Duration.ofNanos(1), events);
        provider.refresh();
        assertEquals(3, provider.listInstallations().size());

        Files.delete(file);
        provider.watchForChanges();

        assertTrue(provider.listInstallations().isEmpty());
        assertThrows(InventoryException.class, provider::fetchPlatformVersion);
    }

    @Test
    void unreadableFileKeepsPreviousInventory() throws IOException {
        var provider = provider(INVENTORY);
        Files.writeString(dir.resolve("inventory.json"), "{ broken");

        assertThrows(java.io.UncheckedIOException.class, provider::refresh);
        assertEquals(3, provider.listInstallations().size());
        assertEquals(List.of("INVENTORY_RELOADED", "WARNING"), events.types());
    }

    private FileInventoryProvider provider(String json) throws IOException {
        var file = Files.writeString(dir.resolve("inventory.json"), json);
        var provider = new FileInventoryProvider(new ObjectMapper(), file.toString(), Duration.ZERO, events);
        provider.refresh();
        return provider;
    }
}
