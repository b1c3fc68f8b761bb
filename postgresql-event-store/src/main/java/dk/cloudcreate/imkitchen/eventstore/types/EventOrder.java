package dk.cloudcreate.imkitchen.eventstore.types;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.essentials.types.LongType;

/**
 * The sequence number of an event within its {@link AggregateEventStream}.<br>
 * The first event of an aggregate has {@link #FIRST_EVENT_ORDER} and the numbers are contiguous: the n'th event always has event order n.<br>
 * The event order of the last persisted event is also the version of the aggregate, which is what is used as the
 * <b>expected version</b> when appending new events.
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * The version of an aggregate that has no persisted events
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(0);
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(1);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }
}
