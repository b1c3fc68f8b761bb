package dk.cloudcreate.imkitchen.aggregates;

import dk.cloudcreate.imkitchen.eventstore.types.EventOrder;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The state of an aggregate instance together with the {@link EventOrder} of the last event folded into it.<br>
 * The event order is used as the expected version when new events are appended, so a snapshot must not be used
 * across units of work.
 *
 * @param <ID>    the aggregate id type
 * @param <STATE> the state type
 */
public final class AggregateSnapshot<ID, STATE> {
    public final ID         aggregateId;
    public final STATE      state;
    public final EventOrder eventOrder;

    public AggregateSnapshot(ID aggregateId, STATE state, EventOrder eventOrder) {
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.state = requireNonNull(state, "No state provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
    }

    /**
     * @return true if no events have been persisted for the aggregate
     */
    public boolean isNew() {
        return eventOrder.equals(EventOrder.NO_EVENTS_PERSISTED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateSnapshot)) return false;
        var that = (AggregateSnapshot<?, ?>) o;
        return aggregateId.equals(that.aggregateId) && state.equals(that.state) && eventOrder.equals(that.eventOrder);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId, state, eventOrder);
    }

    @Override
    public String toString() {
        return "AggregateSnapshot{" +
                "aggregateId=" + aggregateId +
                ", eventOrder=" + eventOrder +
                ", state=" + state +
                '}';
    }
}
