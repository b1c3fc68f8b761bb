package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.types.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A {@link ProjectionHandler} failed to apply an event. The read model writes and the cursor advance were rolled back,
 * so the event will be delivered again
 */
public class ProjectionApplyException extends ProjectionException {
    public final String           projectionName;
    public final AggregateType    aggregateType;
    public final GlobalEventOrder globalEventOrder;
    public final EventType        eventType;

    public ProjectionApplyException(String projectionName,
                                    AggregateType aggregateType,
                                    GlobalEventOrder globalEventOrder,
                                    EventType eventType,
                                    Throwable cause) {
        super(msg("[{}:{}] Failed to apply event '{}' with global order {}: {}",
                  projectionName,
                  aggregateType,
                  eventType,
                  globalEventOrder,
                  cause.getMessage()),
              cause);
        this.projectionName = projectionName;
        this.aggregateType = aggregateType;
        this.globalEventOrder = globalEventOrder;
        this.eventType = eventType;
    }
}
