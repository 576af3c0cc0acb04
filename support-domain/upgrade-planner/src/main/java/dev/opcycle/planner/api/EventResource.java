package dev.opcycle.planner.api;

import dev.opcycle.planner.PlannerEvent;
import dev.opcycle.planner.PlannerEventLog;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

import java.util.List;

/**
 * Recent reloads, snapshots and omitted components, e.g. {@code /api/events?type=COMPONENT_OMITTED}.
 */
@Path("/api/events")
@Produces(MediaType.APPLICATION_JSON)
public class EventResource {

    private final PlannerEventLog eventLog;

    @Inject
    public EventResource(PlannerEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GET
    public List<PlannerEvent> getEvents(
            @QueryParam("type") String type,
            @QueryParam("limit") @DefaultValue("64") @Min(1) @Max(64) int limit) {
        return eventLog.recentEvents(type, limit);
    }
}
