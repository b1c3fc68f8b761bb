package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;

import java.util.*;

/**
 * Number of events applied per {@link ProjectionSubscription} by a {@link ProjectionDrainer} run
 */
public final class DrainResult {
    private final Map<ProjectionSubscription, Integer> appliedEvents;

    DrainResult(Map<ProjectionSubscription, Integer> appliedEvents) {
        this.appliedEvents = Collections.unmodifiableMap(new LinkedHashMap<>(appliedEvents));
    }

    public int totalAppliedEvents() {
        return appliedEvents.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int appliedEvents(String projectionName, AggregateType aggregateType) {
        return appliedEvents.entrySet()
                            .stream()
                            .filter(entry -> entry.getKey().projectionName().equals(projectionName) && entry.getKey().aggregateType.equals(aggregateType))
                            .mapToInt(Map.Entry::getValue)
                            .sum();
    }

    public int appliedEvents(String projectionName) {
        return appliedEvents.entrySet()
                            .stream()
                            .filter(entry -> entry.getKey().projectionName().equals(projectionName))
                            .mapToInt(Map.Entry::getValue)
                            .sum();
    }

    public Map<ProjectionSubscription, Integer> asMap() {
        return appliedEvents;
    }

    @Override
    public String toString() {
        return "DrainResult" + appliedEvents;
    }
}
