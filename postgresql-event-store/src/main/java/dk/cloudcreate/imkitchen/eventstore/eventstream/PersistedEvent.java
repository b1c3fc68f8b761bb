package dk.cloudcreate.imkitchen.eventstore.eventstream;

import dk.cloudcreate.imkitchen.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An immutable event as it was committed to the event store
 */
public final class PersistedEvent {
    private final EventId          eventId;
    private final AggregateType    aggregateType;
    private final String           aggregateId;
    private final EventJSON        event;
    private final EventOrder       eventOrder;
    private final EventRevision    eventRevision;
    private final GlobalEventOrder globalEventOrder;
    private final EventMetaData    metaData;
    private final OffsetDateTime   timestamp;

    private PersistedEvent(EventId eventId,
                           AggregateType aggregateType,
                           String aggregateId,
                           EventJSON event,
                           EventOrder eventOrder,
                           EventRevision eventRevision,
                           GlobalEventOrder globalEventOrder,
                           EventMetaData metaData,
                           OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.event = requireNonNull(event, "No event provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.eventRevision = requireNonNull(eventRevision, "No eventRevision provided");
        this.globalEventOrder = requireNonNull(globalEventOrder, "No globalEventOrder provided");
        this.metaData = requireNonNull(metaData, "No metaData provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static PersistedEvent from(EventId eventId,
                                      AggregateType aggregateType,
                                      String aggregateId,
                                      EventJSON event,
                                      EventOrder eventOrder,
                                      EventRevision eventRevision,
                                      GlobalEventOrder globalEventOrder,
                                      EventMetaData metaData,
                                      OffsetDateTime timestamp) {
        return new PersistedEvent(eventId, aggregateType, aggregateId, event, eventOrder, eventRevision, globalEventOrder, metaData, timestamp);
    }

    public EventId eventId() {
        return eventId;
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public EventJSON event() {
        return event;
    }

    public EventType eventType() {
        return event.eventType();
    }

    /**
     * The sequence number of the event within its aggregate stream
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    public EventRevision eventRevision() {
        return eventRevision;
    }

    public GlobalEventOrder globalEventOrder() {
        return globalEventOrder;
    }

    public EventMetaData metaData() {
        return metaData;
    }

    /**
     * The time the event was committed. Projections should prefer the time fields carried by the event itself
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        PersistedEvent that = (PersistedEvent) o;
        return eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", eventType=" + event.eventType() +
                ", eventOrder=" + eventOrder +
                ", globalEventOrder=" + globalEventOrder +
                ", eventId=" + eventId +
                ", timestamp=" + timestamp +
                '}';
    }
}
