package dk.cloudcreate.imkitchen.eventstore.types;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.essentials.types.LongType;

/**
 * The position of an event across all events of the same {@link AggregateType}.<br>
 * Global event orders are increasing in commit order within an {@link AggregateType}, but may contain gaps
 * (e.g. caused by rolled back appends).
 */
public class GlobalEventOrder extends LongType<GlobalEventOrder> {
    /**
     * Position before the first event, i.e. the cursor value of a subscriber that hasn't received any events
     */
    public static final GlobalEventOrder NONE               = GlobalEventOrder.of(0);
    public static final GlobalEventOrder FIRST_GLOBAL_EVENT = GlobalEventOrder.of(1);

    public GlobalEventOrder(Long value) {
        super(value);
    }

    public static GlobalEventOrder of(long value) {
        return new GlobalEventOrder(value);
    }

    public GlobalEventOrder next() {
        return new GlobalEventOrder(value() + 1);
    }
}
