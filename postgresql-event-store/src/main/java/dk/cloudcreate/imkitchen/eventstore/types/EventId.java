package dk.cloudcreate.imkitchen.eventstore.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }

    public static EventId random() {
        return new EventId(UUID.randomUUID().toString());
    }
}
