package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The pairing of a {@link ProjectionHandler} and one of its aggregate types. Each subscription has its own cursor
 */
public final class ProjectionSubscription {
    public final ProjectionHandler handler;
    public final AggregateType     aggregateType;

    public ProjectionSubscription(ProjectionHandler handler, AggregateType aggregateType) {
        this.handler = requireNonNull(handler, "No handler provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
    }

    public String projectionName() {
        return handler.projectionName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectionSubscription)) return false;
        var that = (ProjectionSubscription) o;
        return projectionName().equals(that.projectionName()) && aggregateType.equals(that.aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(projectionName(), aggregateType);
    }

    @Override
    public String toString() {
        return projectionName() + ":" + aggregateType;
    }
}
