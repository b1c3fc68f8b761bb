package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.eventstore.types.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of the event storage for a single {@link AggregateType}: the name of its event table, the serializer
 * and the registry of the event types (logical name, Java class and revision) that may be appended to streams of this type.
 */
public class AggregateTypeConfiguration {
    public final AggregateType  aggregateType;
    public final String         eventStreamTableName;
    public final JSONSerializer jsonSerializer;

    private final Map<EventType, Registration> registrationsByEventType = new ConcurrentHashMap<>();
    private final Map<Class<?>, Registration>  registrationsByJavaType  = new ConcurrentHashMap<>();

    public AggregateTypeConfiguration(AggregateType aggregateType,
                                      String eventStreamTableName,
                                      JSONSerializer jsonSerializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventStreamTableName = requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase(Locale.ROOT);
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        requireTrue(this.eventStreamTableName.matches("[a-z][a-z0-9_]*"),
                    msg("[{}] Table name '{}' may only contain lower case letters, digits and underscores", aggregateType, eventStreamTableName));
    }

    /**
     * Create a configuration using the table name <code>{aggregateType}_events</code>
     */
    public static AggregateTypeConfiguration standardConfigurationFor(AggregateType aggregateType, JSONSerializer jsonSerializer) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return new AggregateTypeConfiguration(aggregateType,
                                              aggregateType.toString().toLowerCase(Locale.ROOT) + "_events",
                                              jsonSerializer);
    }

    public AggregateTypeConfiguration registerEventType(String eventType, Class<?> javaType) {
        return registerEventType(eventType, javaType, EventRevision.FIRST);
    }

    public AggregateTypeConfiguration registerEventType(String eventType, Class<?> javaType, EventRevision revision) {
        var registration = new Registration(EventType.of(eventType),
                                            requireNonNull(javaType, "No javaType provided"),
                                            requireNonNull(revision, "No revision provided"));
        var existing = registrationsByEventType.putIfAbsent(registration.eventType, registration);
        if (existing != null && !existing.javaType.equals(javaType)) {
            throw new EventStoreException(msg("[{}] Event type '{}' is already registered for {}",
                                              aggregateType, eventType, existing.javaType.getName()));
        }
        registrationsByJavaType.put(javaType, registration);
        return this;
    }

    /**
     * Resolve the registration of an event that is about to be appended
     *
     * @throws EventStoreException if the event's class isn't registered
     */
    public Registration registrationFor(Object event) {
        requireNonNull(event, "No event provided");
        var registration = registrationsByJavaType.get(event.getClass());
        if (registration == null) {
            throw new EventStoreException(msg("[{}] Event class {} isn't registered as an event type", aggregateType, event.getClass().getName()));
        }
        return registration;
    }

    /**
     * Resolve the registration of an event type read from the event table
     *
     * @throws EventStoreException if the event type is unknown
     */
    public Registration registrationFor(EventType eventType) {
        var registration = registrationsByEventType.get(requireNonNull(eventType, "No eventType provided"));
        if (registration == null) {
            throw new EventStoreException(msg("[{}] Unknown event type '{}' found in table '{}'", aggregateType, eventType, eventStreamTableName));
        }
        return registration;
    }

    public Set<EventType> registeredEventTypes() {
        return Set.copyOf(registrationsByEventType.keySet());
    }

    @Override
    public String toString() {
        return "AggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventStreamTableName='" + eventStreamTableName + '\'' +
                ", eventTypes=" + registrationsByEventType.keySet() +
                '}';
    }

    public static final class Registration {
        public final EventType     eventType;
        public final Class<?>      javaType;
        public final EventRevision revision;

        private Registration(EventType eventType, Class<?> javaType, EventRevision revision) {
            this.eventType = eventType;
            this.javaType = javaType;
            this.revision = revision;
        }
    }
}
