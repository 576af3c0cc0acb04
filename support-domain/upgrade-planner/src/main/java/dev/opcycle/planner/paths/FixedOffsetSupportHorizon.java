package dev.opcycle.planner.paths;

import dev.opcycle.planner.model.PlatformSnapshot;
import dev.opcycle.planner.model.UpgradeStep;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Provisional estimate: a typical support cycle counted from today, whatever the target versions are.
 */
@ApplicationScoped
public class FixedOffsetSupportHorizon implements SupportHorizonPolicy {

    private final Clock clock;
    private final int months;

    @Inject
    public FixedOffsetSupportHorizon(Clock clock, @ConfigProperty(name = "planner.support-horizon-months") int months) {
        this.clock = clock;
        this.months = months;
    }

    // TODO: use the maintenance end date of each step's target version once the lifecycle source publishes it
    @Override
    public Instant estimateSupportedUntil(PlatformSnapshot snapshot, List<UpgradeStep> steps) {
        return clock.instant().atZone(ZoneOffset.UTC).plusMonths(months).toInstant();
    }
}
