package dk.cloudcreate.imkitchen.eventstore;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.persistence.*;
import dk.cloudcreate.imkitchen.eventstore.transaction.*;
import dk.cloudcreate.imkitchen.eventstore.types.*;
import dk.cloudcreate.essentials.types.LongRange;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;

/**
 * Append-only store of immutable events, partitioned into one ordered {@link AggregateEventStream} per aggregate instance.<br>
 * <br>
 * Writes must happen inside an {@link EventStoreUnitOfWork} (see {@link #getUnitOfWorkFactory()}), so that an append commits
 * together with any other writes the caller makes in the same transaction. Reads join the current {@link EventStoreUnitOfWork}
 * if one exists, otherwise they run in their own short transaction.
 */
public interface EventStore {
    EventStoreUnitOfWorkFactory getUnitOfWorkFactory();

    /**
     * Register an aggregate type (its table and its event types). Creates the event table if it doesn't exist
     */
    EventStore addAggregateTypeConfiguration(AggregateTypeConfiguration aggregateTypeConfiguration);

    AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType);

    /**
     * Append events to the stream of an aggregate instance.<br>
     * All events are committed atomically (together with the rest of the {@link EventStoreUnitOfWork}) and receive the
     * contiguous event orders <code>expectedVersion + 1 .. expectedVersion + events.size()</code>
     *
     * @param aggregateType   the aggregate type
     * @param aggregateId     the aggregate id (its <code>toString()</code> value is stored)
     * @param expectedVersion the event order of the last event the caller folded, {@link EventOrder#NO_EVENTS_PERSISTED} for a new aggregate
     * @param events          the events to append (at least one)
     * @param metaData        metadata stored with every event
     * @return the stream of appended events; its {@link AggregateEventStream#eventOrderRange()} is the committed range
     * @throws OptimisticAppendToStreamException if <code>expectedVersion</code> doesn't match the last committed event order
     */
    AggregateEventStream appendToStream(AggregateType aggregateType,
                                        Object aggregateId,
                                        EventOrder expectedVersion,
                                        List<?> events,
                                        EventMetaData metaData);

    default AggregateEventStream appendToStream(AggregateType aggregateType,
                                                Object aggregateId,
                                                EventOrder expectedVersion,
                                                List<?> events) {
        return appendToStream(aggregateType, aggregateId, expectedVersion, events, EventMetaData.empty());
    }

    /**
     * Load all events of an aggregate instance ordered by event order
     *
     * @return the event stream or {@link Optional#empty()} if no events have been persisted for the aggregate
     */
    Optional<AggregateEventStream> fetchStream(AggregateType aggregateType, Object aggregateId);

    Optional<PersistedEvent> loadLastPersistedEventRelatedTo(AggregateType aggregateType, Object aggregateId);

    /**
     * Load the events of all aggregate instances of the given type within the global order range, ordered by global order
     */
    List<PersistedEvent> loadEventsByGlobalOrder(AggregateType aggregateType, LongRange globalOrderRange);

    /**
     * Load the next <code>batchSize</code> events following <code>afterGlobalOrder</code>, ordered by global order
     */
    List<PersistedEvent> loadEventsAfterGlobalOrder(AggregateType aggregateType, GlobalEventOrder afterGlobalOrder, int batchSize);

    /**
     * @return the highest global order persisted for the aggregate type or {@link GlobalEventOrder#NONE}
     */
    GlobalEventOrder highestGlobalEventOrder(AggregateType aggregateType);

    /**
     * Create an unbounded stream of the events of an aggregate type, starting at <code>fromInclusiveGlobalOrder</code>,
     * that polls the event table for new events every <code>pollingInterval</code>
     */
    Flux<PersistedEvent> pollEvents(AggregateType aggregateType,
                                    long fromInclusiveGlobalOrder,
                                    int batchSize,
                                    Duration pollingInterval);

    /**
     * Drop and recreate the event table of an aggregate type. Only intended for tests
     */
    void resetEventStorageFor(AggregateType aggregateType);
}
