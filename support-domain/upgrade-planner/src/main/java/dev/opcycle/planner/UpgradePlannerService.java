package dev.opcycle.planner;

import dev.opcycle.planner.model.MaintenanceWindow;
import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.RecommendationBundle;
import dev.opcycle.planner.model.UpgradePath;
import dev.opcycle.planner.paths.PathGenerator;
import dev.opcycle.planner.schedule.MaintenanceWindowScheduler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Produces upgrade recommendations: snapshot, candidate paths and maintenance windows.
 */
@ApplicationScoped
public class UpgradePlannerService {

    private static final Logger LOG = Logger.getLogger(UpgradePlannerService.class);

    private final PlatformStatusService platformStatusService;
    private final PathGenerator pathGenerator;
    private final MaintenanceWindowScheduler scheduler;
    private final Clock clock;

    @Inject
    public UpgradePlannerService(
            PlatformStatusService platformStatusService,
            PathGenerator pathGenerator,
            MaintenanceWindowScheduler scheduler,
            Clock clock) {
        this.platformStatusService = platformStatusService;
        this.pathGenerator = pathGenerator;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public RecommendationBundle recommend() {
        return recommend(platformStatusService.getPlatformStatus());
    }

    public RecommendationBundle recommend(PlatformSnapshot snapshot) {
        var paths = pathGenerator.generate(snapshot);
        var windows = scheduler.schedule(snapshot, paths);
        LOG.debugf("Generated %d upgrade paths and %d maintenance windows for %d components",
                paths.size(), windows.size(), snapshot.components().size());
        return new RecommendationBundle(snapshot, paths, windows, clock.instant());
    }

    public Optional<UpgradePath> findPath(String pathId) {
        return recommend().recommendedPaths().stream()
                .filter(path -> path.id().equals(pathId))
                .findFirst();
    }

    public List<MaintenanceWindow> maintenanceWindows() {
        return recommend().maintenanceWindows();
    }
}
