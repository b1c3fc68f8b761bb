package dk.cloudcreate.imkitchen.eventstore.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireTrue;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The stable, logical name of an event type (e.g. <code>RecipeFavorited</code>) as stored in the event tables.<br>
 * The name is decoupled from the Java class name, so event classes can be moved or renamed without rewriting history.
 */
public class EventType extends CharSequenceType<EventType> {
    public EventType(CharSequence value) {
        super(value);
        requireTrue(value.toString().matches("[A-Za-z][A-Za-z0-9_]*"), msg("'{}' is not a valid event type name", value));
    }

    public static EventType of(CharSequence value) {
        return new EventType(value);
    }
}
