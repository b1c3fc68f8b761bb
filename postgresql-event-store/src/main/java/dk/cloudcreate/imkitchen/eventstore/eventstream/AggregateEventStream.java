package dk.cloudcreate.imkitchen.eventstore.eventstream;

import dk.cloudcreate.imkitchen.eventstore.types.EventOrder;
import dk.cloudcreate.essentials.types.LongRange;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events of a single aggregate instance, ordered by {@link EventOrder}.<br>
 * Returned both when loading a stream and as the result of an append, where {@link #eventOrderRange()} is the committed sequence range.
 */
public class AggregateEventStream {
    private final AggregateType        aggregateType;
    private final String               aggregateId;
    private final LongRange            eventOrderRange;
    private final List<PersistedEvent> events;

    private AggregateEventStream(AggregateType aggregateType, String aggregateId, LongRange eventOrderRange, List<PersistedEvent> events) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.eventOrderRange = requireNonNull(eventOrderRange, "No eventOrderRange provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    public static AggregateEventStream of(AggregateType aggregateType, String aggregateId, LongRange eventOrderRange, List<PersistedEvent> events) {
        return new AggregateEventStream(aggregateType, aggregateId, eventOrderRange, events);
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public LongRange eventOrderRange() {
        return eventOrderRange;
    }

    public List<PersistedEvent> eventList() {
        return events;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return the event order of the last event in this stream or {@link EventOrder#NO_EVENTS_PERSISTED} if the stream is empty
     */
    public EventOrder lastEventOrder() {
        return events.isEmpty() ? EventOrder.NO_EVENTS_PERSISTED : events.get(events.size() - 1).eventOrder();
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", eventOrderRange=" + eventOrderRange +
                ", events=" + events.size() +
                '}';
    }
}
