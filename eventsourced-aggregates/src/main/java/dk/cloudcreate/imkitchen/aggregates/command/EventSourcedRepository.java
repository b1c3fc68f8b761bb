package dk.cloudcreate.imkitchen.aggregates.command;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.eventstore.*;
import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.persistence.OptimisticAppendToStreamException;
import dk.cloudcreate.imkitchen.eventstore.types.EventOrder;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Loads and appends the events of one {@link EventSourcedAggregate} type.<br>
 * <br>
 * Typical usage inside a {@link CommandHandler} (which runs inside the {@link dk.cloudcreate.imkitchen.eventstore.transaction.EventStoreUnitOfWork}
 * started by the {@link CommandBus}):
 * <pre>{@code
 * var recipe = recipes.load(command.recipeId);
 * var events = recipe.state.favorite(command.requestedBy, clock.instant());
 * recipes.append(recipe, events);
 * }</pre>
 * The {@link AggregateSnapshot#eventOrder} of the loaded snapshot is used as the expected version, so a concurrent
 * append to the same aggregate between the load and the append fails with an {@link OptimisticAppendToStreamException}.
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the base event type
 * @param <STATE> the state type
 */
public class EventSourcedRepository<ID, EVENT, STATE> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);

    private final EventStore                              eventStore;
    private final EventSourcedAggregate<ID, EVENT, STATE> aggregate;

    public EventSourcedRepository(EventStore eventStore, EventSourcedAggregate<ID, EVENT, STATE> aggregate) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.aggregate = requireNonNull(aggregate, "No aggregate provided");
    }

    public AggregateType aggregateType() {
        return aggregate.aggregateType();
    }

    /**
     * Fold the events of the aggregate instance
     *
     * @return the snapshot or {@link Optional#empty()} if the aggregate doesn't have any events
     */
    public Optional<AggregateSnapshot<ID, STATE>> tryLoad(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var potentialStream = eventStore.fetchStream(aggregate.aggregateType(), aggregateId);
        if (potentialStream.isEmpty()) {
            log.trace("[{}] Didn't find an aggregate with id '{}'", aggregate.aggregateType(), aggregateId);
            return Optional.empty();
        }
        var stream = potentialStream.get();
        var events = new ArrayList<EVENT>(stream.eventList().size());
        for (var persistedEvent : stream.eventList()) {
            events.add(persistedEvent.event()
                                     .deserializeAs(aggregate.eventType())
                                     .orElseThrow(() -> new AggregateException(msg("[{}] Event '{}' with event order {} of aggregate '{}' isn't a {}",
                                                                                   aggregate.aggregateType(),
                                                                                   persistedEvent.eventType(),
                                                                                   persistedEvent.eventOrder(),
                                                                                   aggregateId,
                                                                                   aggregate.eventType().getName()))));
        }
        log.trace("[{}] Rehydrating '{}' from {} event(s)", aggregate.aggregateType(), aggregateId, events.size());
        return Optional.of(new AggregateSnapshot<>(aggregateId, aggregate.rehydrate(events), stream.lastEventOrder()));
    }

    /**
     * @throws AggregateNotFoundException if the aggregate doesn't have any events
     */
    public AggregateSnapshot<ID, STATE> load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregate.aggregateType()));
    }

    /**
     * Load the aggregate or return the {@link EventSourcedAggregate#initialState()} with {@link EventOrder#NO_EVENTS_PERSISTED}
     * if it doesn't exist yet
     */
    public AggregateSnapshot<ID, STATE> loadOrInitial(ID aggregateId) {
        return tryLoad(aggregateId).orElseGet(() -> new AggregateSnapshot<>(aggregateId, aggregate.initialState(), EventOrder.NO_EVENTS_PERSISTED));
    }

    public AggregateSnapshot<ID, STATE> append(AggregateSnapshot<ID, STATE> snapshot, List<? extends EVENT> events) {
        return append(snapshot, events, EventMetaData.empty());
    }

    /**
     * Append the events decided from <code>snapshot</code>, using {@link AggregateSnapshot#eventOrder} as the expected version.
     * An empty list of events is a no-op.
     *
     * @return the snapshot with the new events folded in
     * @throws OptimisticAppendToStreamException if another append to the same aggregate committed after the snapshot was loaded
     */
    public AggregateSnapshot<ID, STATE> append(AggregateSnapshot<ID, STATE> snapshot, List<? extends EVENT> events, EventMetaData metaData) {
        requireNonNull(snapshot, "No snapshot provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            log.trace("[{}] No events to append to '{}'", aggregate.aggregateType(), snapshot.aggregateId);
            return snapshot;
        }
        var appended = eventStore.appendToStream(aggregate.aggregateType(),
                                                 snapshot.aggregateId,
                                                 snapshot.eventOrder,
                                                 events,
                                                 metaData);
        var state = snapshot.state;
        for (EVENT event : events) {
            state = aggregate.apply(state, event);
        }
        return new AggregateSnapshot<>(snapshot.aggregateId, state, appended.lastEventOrder());
    }
}
