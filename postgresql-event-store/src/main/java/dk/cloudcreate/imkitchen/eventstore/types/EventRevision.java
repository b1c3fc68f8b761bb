package dk.cloudcreate.imkitchen.eventstore.types;

import dk.cloudcreate.essentials.types.IntegerType;

/**
 * The revision of an event type's field set. Increase it when the fields of an event class change in a way that readers must know about.
 */
public class EventRevision extends IntegerType<EventRevision> {
    public static final EventRevision FIRST = EventRevision.of(1);

    public EventRevision(Integer value) {
        super(value);
    }

    public static EventRevision of(int value) {
        return new EventRevision(value);
    }
}
