package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.common.transaction.HandleAwareUnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;
import org.jdbi.v3.core.Handle;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link ProjectionHandler} for the events of a single aggregate type, which all share the base type <code>EVENT</code>.<br>
 * Deserializes the payload and passes the typed event to {@link #handle(Handle, PersistedEvent, Object)}, where subclasses
 * typically dispatch through the event's visitor.
 *
 * @param <EVENT> the base type of the events
 */
public abstract class TypedProjectionHandler<EVENT> implements ProjectionHandler {
    private final Class<EVENT> eventType;

    protected TypedProjectionHandler(Class<EVENT> eventType) {
        this.eventType = requireNonNull(eventType, "No eventType provided");
    }

    @Override
    public final void apply(HandleAwareUnitOfWork unitOfWork, PersistedEvent event) {
        var typedEvent = event.event()
                              .deserializeAs(eventType)
                              .orElseThrow(() -> new ProjectionException(msg("[{}] Event '{}' with global order {} isn't a {}",
                                                                             projectionName(),
                                                                             event.eventType(),
                                                                             event.globalEventOrder(),
                                                                             eventType.getName())));
        handle(unitOfWork.handle(), event, typedEvent);
    }

    /**
     * @param handle         the handle of the transaction that also advances the cursor
     * @param persistedEvent the persisted event (global order, timestamp, metadata)
     * @param event          the deserialized payload
     */
    protected abstract void handle(Handle handle, PersistedEvent persistedEvent, EVENT event);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + projectionName() + "}";
    }
}
