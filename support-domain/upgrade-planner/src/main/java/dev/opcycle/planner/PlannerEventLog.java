package dev.opcycle.planner;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded history of planner events, newest first.
 * <p>
 * Omitted components and degraded lookups are only visible here and in the log, so the history can be
 * narrowed to one event type.
 */
@ApplicationScoped
public class PlannerEventLog {

    static final int MAX_EVENTS = 64;

    private final Deque<PlannerEvent> history = new ArrayDeque<>();

    void record(@Observes PlannerEvent event) {
        synchronized (history) {
            history.addFirst(event);
            if (history.size() > MAX_EVENTS) {
                history.removeLast();
            }
        }
    }

    /**
     * At most {@code limit} events, optionally only those whose type equals {@code type} ignoring case.
     */
    public List<PlannerEvent> recentEvents(String type, int limit) {
        synchronized (history) {
            return history.stream()
                    .filter(event -> type == null || type.isBlank() || event.type().equalsIgnoreCase(type))
                    .limit(Math.max(0, limit))
                    .toList();
        }
    }
}
