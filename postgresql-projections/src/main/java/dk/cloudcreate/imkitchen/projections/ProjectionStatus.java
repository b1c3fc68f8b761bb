package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.types.GlobalEventOrder;

import java.time.Instant;
import java.util.Optional;

/**
 * Point in time status of a {@link ProjectionSubscription} as seen by the {@link ProjectionRunner}
 */
public final class ProjectionStatus {
    public final String           projectionName;
    public final AggregateType    aggregateType;
    public final GlobalEventOrder cursor;
    public final GlobalEventOrder highestGlobalEventOrder;
    public final int              consecutiveFailures;
    public final String           lastError;
    public final Instant          lastFailureAt;

    ProjectionStatus(String projectionName,
                     AggregateType aggregateType,
                     GlobalEventOrder cursor,
                     GlobalEventOrder highestGlobalEventOrder,
                     int consecutiveFailures,
                     String lastError,
                     Instant lastFailureAt) {
        this.projectionName = projectionName;
        this.aggregateType = aggregateType;
        this.cursor = cursor;
        this.highestGlobalEventOrder = highestGlobalEventOrder;
        this.consecutiveFailures = consecutiveFailures;
        this.lastError = lastError;
        this.lastFailureAt = lastFailureAt;
    }

    /**
     * Distance in global order between the newest event and the cursor (an upper bound of the number of pending events,
     * since the global order may contain gaps)
     */
    public long lag() {
        return Math.max(0, highestGlobalEventOrder.longValue() - cursor.longValue());
    }

    public boolean isFailing() {
        return consecutiveFailures > 0;
    }

    public Optional<String> lastError() {
        return Optional.ofNullable(lastError);
    }

    @Override
    public String toString() {
        return "ProjectionStatus{" +
                "projectionName='" + projectionName + '\'' +
                ", aggregateType=" + aggregateType +
                ", cursor=" + cursor +
                ", lag=" + lag() +
                ", consecutiveFailures=" + consecutiveFailures +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}
