package dev.opcycle.planner.schedule;

import dev.opcycle.planner.model.MaintenanceWindow;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.Priority;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.paths.AggressiveStrategy;
import dev.opcycle.planner.paths.BalancedStrategy;
import dev.opcycle.planner.paths.CriticalIssuesStrategy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Proposes maintenance windows for the generated paths.
 * <p>
 * Windows come out in escalation order (immediate critical fix, regular maintenance, lifecycle deadline) and
 * are not re-sorted by date.
 */
@ApplicationScoped
public class MaintenanceWindowScheduler {

    static final int SUPPORT_EXPIRY_THRESHOLD_DAYS = 90;

    private final Clock clock;

    @Inject
    public MaintenanceWindowScheduler(Clock clock) {
        this.clock = clock;
    }

    public List<MaintenanceWindow> schedule(PlatformSnapshot snapshot, List<UpgradePath> paths) {
        List<MaintenanceWindow> windows = new ArrayList<>();

        if (snapshot.criticalIssues() > 0) {
            find(paths, CriticalIssuesStrategy.ID).ifPresent(path -> windows.add(window(
                    "immediate-window", 7, Priority.HIGH,
                    "Critical issues detected that may block cluster operations", path)));
        }

        find(paths, BalancedStrategy.ID).ifPresent(path -> windows.add(window(
                "regular-maintenance", 30,
                snapshot.criticalIssues() > 0 ? Priority.HIGH : Priority.MEDIUM,
                "Regular maintenance to keep platform current and supported", path)));

        var expiresIn = snapshot.supportExpiresIn();
        if (expiresIn != null && expiresIn < SUPPORT_EXPIRY_THRESHOLD_DAYS) {
            find(paths, AggressiveStrategy.ID).ifPresent(path -> windows.add(window(
                    "lifecycle-maintenance", 14, Priority.HIGH,
                    "Platform support expires in " + expiresIn + " days", path)));
        }

        return List.copyOf(windows);
    }

    private MaintenanceWindow window(String id, int daysOut, Priority priority, String reason, UpgradePath path) {
        return new MaintenanceWindow(
                id,
                clock.instant().plus(Duration.ofDays(daysOut)),
                priority,
                reason,
                path.affectedComponents(),
                path.estimatedDuration(),
                path);
    }

    private static Optional<UpgradePath> find(List<UpgradePath> paths, String id) {
        return paths.stream().filter(path -> path.id().equals(id)).findFirst();
    }
}
