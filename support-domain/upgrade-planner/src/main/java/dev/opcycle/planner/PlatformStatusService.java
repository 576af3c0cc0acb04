package dev.opcycle.planner;

import dev.opcycle.planner.inventory.InventoryException;
import dev.opcycle.planner.inventory.InventoryProvider;
import dev.opcycle.planner.issues.IssueDetector;
import dev.opcycle.planner.issues.UpgradeDetector;
import dev.opcycle.planner.lifecycle.LifecycleService;
import dev.opcycle.planner.model.Channel;
import dev.opcycle.planner.model.ComponentInstallation;
import dev.opcycle.planner.model.ComponentStatus;
import dev.opcycle.planner.model.HealthStatus;
import dev.opcycle.planner.model.IssueSeverity;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.PlatformVersion;
import dev.opcycle.planner.version.Versions;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Builds {@link PlatformSnapshot}s from the inventory and lifecycle sources.
 * <p>
 * Platform data is mandatory. Component details are gathered concurrently on a bounded pool; a component
 * that fails or misses the deadline is left out of the snapshot and listed as omitted.
 */
@ApplicationScoped
public class PlatformStatusService {

    private static final Logger LOG = Logger.getLogger(PlatformStatusService.class);
    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final InventoryProvider inventory;
    private final LifecycleService lifecycleService;
    private final UpgradeDetector upgradeDetector;
    private final IssueDetector issueDetector;
    private final Clock clock;
    private final Event<PlannerEvent> events;
    private final Duration deadline;
    private final ExecutorService executor;

    @Inject
    public PlatformStatusService(
            InventoryProvider inventory,
            LifecycleService lifecycleService,
            UpgradeDetector upgradeDetector,
            IssueDetector issueDetector,
            Clock clock,
            Event<PlannerEvent> events,
            @ConfigProperty(name = "planner.snapshot.workers") int workers,
            @ConfigProperty(name = "planner.snapshot.deadline") Duration deadline) {
        this.inventory = inventory;
        this.lifecycleService = lifecycleService;
        this.upgradeDetector = upgradeDetector;
        this.issueDetector = issueDetector;
        this.clock = clock;
        this.events = events;
        this.deadline = deadline;
        var threads = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), runnable -> {
            var thread = new Thread(runnable, "snapshot-worker-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public PlatformSnapshot getPlatformStatus() {
        var platform = fetchPlatform();
        var installations = inventory.listInstallations();

        List<Future<ComponentStatus>> futures = new ArrayList<>();
        for (ComponentInstallation installation : installations) {
            futures.add(executor.submit(() -> componentStatus(installation, platform)));
        }

        long deadlineAt = System.nanoTime() + deadline.toNanos();
        List<ComponentStatus> components = new ArrayList<>();
        List<String> omitted = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            var future = futures.get(i);
            var installation = installations.get(i);
            try {
                long remaining = Math.max(0, deadlineAt - System.nanoTime());
                components.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (ExecutionException e) {
                omit(installation, e.getCause(), omitted);
            } catch (TimeoutException e) {
                future.cancel(true);
                omit(installation, new TimeoutException("no answer within " + deadline), omitted);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(pending -> pending.cancel(true));
                throw new SnapshotUnavailableException("Interrupted while gathering component details", e);
            }
        }

        int criticalIssues = (int) components.stream()
                .flatMap(component -> component.issues().stream())
                .filter(issue -> issue.severity() == IssueSeverity.CRITICAL)
                .count();
        int totalIssues = components.stream().mapToInt(component -> component.issues().size()).sum();
        var overallHealth = criticalIssues > 0
                ? HealthStatus.CRITICAL
                : totalIssues > 0 ? HealthStatus.WARNING : HealthStatus.HEALTHY;

        events.fire(PlannerEvent.snapshotAssembled(components.size(), omitted.size()));
        return new PlatformSnapshot(
                platform,
                List.copyOf(components),
                overallHealth,
                totalIssues,
                criticalIssues,
                supportExpiresIn(platform, components),
                List.copyOf(omitted),
                clock.instant());
    }

    /**
     * Status of a single component, empty when it is not installed or its details cannot be read.
     *
     * @throws SnapshotUnavailableException when the platform version is unavailable
     */
    public Optional<ComponentStatus> componentStatus(String namespace, String name) {
        var platform = fetchPlatform();
        var installation = inventory.findInstallation(namespace, name);
        if (installation.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(componentStatus(installation.get(), platform));
        } catch (InventoryException e) {
            LOG.warnf("Failed to get status of %s: %s", installation.get().qualifiedName(), e.getMessage());
            return Optional.empty();
        }
    }

    ComponentStatus componentStatus(ComponentInstallation installation, PlatformVersion platform) {
        var lifecycle = lifecycleService.componentLifecycle(installation.name(), installation.currentVersion());
        var channels = inventory.fetchChannels(installation);
        var currentChannel = channels.stream()
                .filter(channel -> channel.name().equals(installation.currentChannel()))
                .findFirst()
                .orElseGet(() -> Channel.placeholder(installation.currentChannel(), installation.currentVersion()));
        var upgrades = upgradeDetector.detect(installation, channels);
        var issues = issueDetector.detect(installation, lifecycle, currentChannel, platform);
        return new ComponentStatus(installation, lifecycle, upgrades, currentChannel, channels, issues,
                HealthStatus.of(issues));
    }

    private PlatformVersion fetchPlatform() {
        PlatformVersion platform;
        try {
            platform = inventory.fetchPlatformVersion();
        } catch (InventoryException e) {
            LOG.error("Failed to get platform version", e);
            throw new SnapshotUnavailableException("Failed to get platform status", e);
        }
        return lifecycleService.platformLifecycle(Versions.clean(platform.currentVersion()))
                .map(dates -> platform.withSupportDates(
                        dates.fullSupportEndsAt(), dates.maintenanceSupportEndsAt(), dates.endOfLifeAt()))
                .orElse(platform);
    }

    private void omit(ComponentInstallation installation, Throwable cause, List<String> omitted) {
        var component = installation.qualifiedName();
        LOG.warnf(cause, "Failed to get status of %s, leaving it out of the snapshot", component);
        omitted.add(component);
        events.fire(PlannerEvent.componentOmitted(component, String.valueOf(cause.getMessage())));
    }

    /**
     * Whole days until the earliest maintenance-support end across the platform and its components.
     */
    private Integer supportExpiresIn(PlatformVersion platform, List<ComponentStatus> components) {
        var now = clock.instant();
        return Stream.concat(
                        Stream.ofNullable(platform.maintenanceSupportEndsAt()),
                        components.stream().map(component -> component.lifecycleInfo().maintenanceSupportEndsAt()))
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .map(earliest -> (int) Math.floorDiv(Duration.between(now, earliest).toMillis(), MILLIS_PER_DAY))
                .orElse(null);
    }
}
