package dk.cloudcreate.imkitchen.eventstore;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.persistence.*;
import dk.cloudcreate.imkitchen.eventstore.transaction.*;
import dk.cloudcreate.imkitchen.eventstore.types.*;
import dk.cloudcreate.essentials.shared.functional.CheckedFunction;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.ConnectionException;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * PostgreSQL {@link EventStore} that delegates the storage to a {@link SeparateTablePerAggregateTypePersistenceStrategy}
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final EventStoreUnitOfWorkFactory                      unitOfWorkFactory;
    private final SeparateTablePerAggregateTypePersistenceStrategy persistenceStrategy;

    public PostgresqlEventStore(EventStoreUnitOfWorkFactory unitOfWorkFactory,
                                SeparateTablePerAggregateTypePersistenceStrategy persistenceStrategy) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.persistenceStrategy = requireNonNull(persistenceStrategy, "No persistenceStrategy provided");
    }

    @Override
    public EventStoreUnitOfWorkFactory getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    @Override
    public EventStore addAggregateTypeConfiguration(AggregateTypeConfiguration aggregateTypeConfiguration) {
        persistenceStrategy.addAggregateTypeConfiguration(aggregateTypeConfiguration);
        return this;
    }

    @Override
    public AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType) {
        return persistenceStrategy.getAggregateTypeConfiguration(aggregateType);
    }

    @Override
    public AggregateEventStream appendToStream(AggregateType aggregateType,
                                               Object aggregateId,
                                               EventOrder expectedVersion,
                                               List<?> events,
                                               EventMetaData metaData) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var unitOfWork = unitOfWorkFactory.getRequiredUnitOfWork();
        return persistenceStrategy.persist(unitOfWork,
                                           aggregateType,
                                           aggregateId.toString(),
                                           expectedVersion,
                                           events,
                                           metaData);
    }

    @Override
    public Optional<AggregateEventStream> fetchStream(AggregateType aggregateType, Object aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return read(unitOfWork -> persistenceStrategy.loadAggregateEvents(unitOfWork, aggregateType, aggregateId.toString()));
    }

    @Override
    public Optional<PersistedEvent> loadLastPersistedEventRelatedTo(AggregateType aggregateType, Object aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return read(unitOfWork -> persistenceStrategy.loadLastPersistedEventRelatedTo(unitOfWork, aggregateType, aggregateId.toString()));
    }

    @Override
    public List<PersistedEvent> loadEventsByGlobalOrder(AggregateType aggregateType, LongRange globalOrderRange) {
        return read(unitOfWork -> persistenceStrategy.loadEventsByGlobalOrder(unitOfWork, aggregateType, globalOrderRange));
    }

    @Override
    public List<PersistedEvent> loadEventsAfterGlobalOrder(AggregateType aggregateType, GlobalEventOrder afterGlobalOrder, int batchSize) {
        return read(unitOfWork -> persistenceStrategy.loadEventsAfterGlobalOrder(unitOfWork, aggregateType, afterGlobalOrder, batchSize));
    }

    @Override
    public GlobalEventOrder highestGlobalEventOrder(AggregateType aggregateType) {
        return read(unitOfWork -> persistenceStrategy.highestGlobalEventOrder(unitOfWork, aggregateType));
    }

    @Override
    public void resetEventStorageFor(AggregateType aggregateType) {
        persistenceStrategy.resetEventStorageFor(aggregateType);
    }

    private <R> R read(CheckedFunction<EventStoreUnitOfWork, R> query) {
        try {
            return unitOfWorkFactory.withUnitOfWork(query);
        } catch (ConnectionException e) {
            throw new EventStoreUnavailableException("Failed to connect to the event store database", e);
        }
    }

    @Override
    public Flux<PersistedEvent> pollEvents(AggregateType aggregateType,
                                           long fromInclusiveGlobalOrder,
                                           int batchSize,
                                           Duration pollingInterval) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(pollingInterval, "No pollingInterval provided");
        requireTrue(fromInclusiveGlobalOrder >= GlobalEventOrder.FIRST_GLOBAL_EVENT.longValue(), "fromInclusiveGlobalOrder must be >= 1");
        requireTrue(batchSize > 0, "batchSize must be > 0");

        var eventStreamLogName  = "EventStream:" + aggregateType;
        var eventStoreStreamLog = LoggerFactory.getLogger(EventStore.class.getName() + ".PollingEventStream");
        eventStoreStreamLog.debug("[{}] Creating polling event stream with fromInclusiveGlobalOrder {} and batch size {}",
                                  eventStreamLogName,
                                  fromInclusiveGlobalOrder,
                                  batchSize);

        var lastDeliveredGlobalOrder = new AtomicLong(fromInclusiveGlobalOrder - 1);
        var persistedEventsFlux = Flux.defer(() -> {
            List<PersistedEvent> persistedEvents;
            try {
                persistedEvents = loadEventsAfterGlobalOrder(aggregateType, GlobalEventOrder.of(lastDeliveredGlobalOrder.get()), batchSize);
            } catch (EventStoreUnavailableException e) {
                eventStoreStreamLog.debug(msg("[{}] Experienced a PostgreSQL connection issue, will retry on the next poll", eventStreamLogName), e);
                return Flux.empty();
            } catch (RuntimeException e) {
                log.error(msg("[{}] Polling failed", eventStreamLogName), e);
                return Flux.error(e);
            }
            if (persistedEvents.isEmpty()) {
                eventStoreStreamLog.trace("[{}] No events after global order {}", eventStreamLogName, lastDeliveredGlobalOrder.get());
            } else {
                eventStoreStreamLog.debug("[{}] Loaded {} events after global order {}", eventStreamLogName, persistedEvents.size(), lastDeliveredGlobalOrder.get());
            }
            return Flux.fromIterable(persistedEvents);
        }).doOnNext(event -> lastDeliveredGlobalOrder.set(event.globalEventOrder().longValue()));

        return persistedEventsFlux.repeatWhen(completed -> completed.delayElements(pollingInterval));
    }
}
