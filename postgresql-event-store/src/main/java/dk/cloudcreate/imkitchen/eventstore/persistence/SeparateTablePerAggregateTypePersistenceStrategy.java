package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;
import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.transaction.*;
import dk.cloudcreate.imkitchen.eventstore.types.*;
import dk.cloudcreate.essentials.shared.Exceptions;
import dk.cloudcreate.essentials.types.LongRange;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Stores the events of each {@link AggregateType} in a separate table:
 * <pre>
 * global_order   bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY
 * aggregate_id   text
 * event_order    bigint       -- sequence number within the aggregate, starting at 1
 * event_id       text
 * event_type     text
 * event_revision integer
 * committed_at   timestamptz
 * event_payload  jsonb
 * event_metadata jsonb
 * UNIQUE (aggregate_id, event_order), UNIQUE (event_id)
 * </pre>
 * Appends to the same table are serialized with a transaction scoped advisory lock. This makes the expected version
 * check race free and guarantees that <code>global_order</code> values become visible in increasing order, so a subscriber
 * that resumes after the highest <code>global_order</code> it has seen never skips an event committed later with a lower value.
 */
public class SeparateTablePerAggregateTypePersistenceStrategy {
    private static final Logger log                          = LoggerFactory.getLogger(SeparateTablePerAggregateTypePersistenceStrategy.class);
    private static final String UNIQUE_VIOLATION_SQL_STATE   = "23505";
    private static final String EVENT_ORDER_CONSTRAINT_INFIX = "aggregate_id_event_order";

    private final ConcurrentMap<AggregateType, AggregateTypeConfiguration> aggregateTypeConfigurations = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateType, String>                     insertSql                   = new ConcurrentHashMap<>();
    private final EventStoreUnitOfWorkFactory                              unitOfWorkFactory;
    private final Clock                                                    clock;

    public SeparateTablePerAggregateTypePersistenceStrategy(EventStoreUnitOfWorkFactory unitOfWorkFactory,
                                                            Clock clock) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public SeparateTablePerAggregateTypePersistenceStrategy addAggregateTypeConfiguration(AggregateTypeConfiguration configuration) {
        requireNonNull(configuration, "No configuration provided");
        var existing = aggregateTypeConfigurations.putIfAbsent(configuration.aggregateType, configuration);
        if (existing == null) {
            initializeEventStorageFor(configuration);
        } else if (existing != configuration) {
            throw new EventStoreException(msg("[{}] A different configuration is already registered", configuration.aggregateType));
        }
        return this;
    }

    public AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType) {
        var configuration = aggregateTypeConfigurations.get(requireNonNull(aggregateType, "No aggregateType provided"));
        if (configuration == null) {
            throw new EventStoreException(msg("Aggregate type '{}' hasn't been configured. Please register it using addAggregateTypeConfiguration(configuration)", aggregateType));
        }
        return configuration;
    }

    public Set<AggregateType> configuredAggregateTypes() {
        return Set.copyOf(aggregateTypeConfigurations.keySet());
    }

    private void initializeEventStorageFor(AggregateTypeConfiguration configuration) {
        log.info("[{}] Initializing event storage in table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            var existingTable = unitOfWork.handle().select("SELECT to_regclass(?)::text", configuration.eventStreamTableName)
                                          .mapTo(String.class)
                                          .findOne();
            if (existingTable.isEmpty()) {
                createEventStreamTable(unitOfWork.handle(), configuration);
            } else {
                log.debug("[{}] Table '{}' already exists", configuration.aggregateType, configuration.eventStreamTableName);
            }
        });
    }

    private void createEventStreamTable(Handle handle, AggregateTypeConfiguration configuration) {
        log.info("[{}] Creating event-stream table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "    global_order   bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "    aggregate_id   text NOT NULL,\n" +
                                    "    event_order    bigint NOT NULL CHECK (event_order > 0),\n" +
                                    "    event_id       text NOT NULL,\n" +
                                    "    event_type     text NOT NULL,\n" +
                                    "    event_revision integer NOT NULL,\n" +
                                    "    committed_at   timestamptz NOT NULL,\n" +
                                    "    event_payload  jsonb NOT NULL,\n" +
                                    "    event_metadata jsonb NOT NULL,\n" +
                                    "    CONSTRAINT {:tableName}_aggregate_id_event_order_key UNIQUE (aggregate_id, event_order),\n" +
                                    "    CONSTRAINT {:tableName}_event_id_key UNIQUE (event_id)\n" +
                                    ")",
                            arg("tableName", configuration.eventStreamTableName)));
    }

    /**
     * Drop and recreate the event table of the given aggregate type. Only intended for tests
     */
    public void resetEventStorageFor(AggregateType aggregateType) {
        var configuration = getAggregateTypeConfiguration(aggregateType);
        log.info("[{}] Resetting event storage in table '{}'", aggregateType, configuration.eventStreamTableName);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute("DROP TABLE IF EXISTS " + configuration.eventStreamTableName);
            createEventStreamTable(unitOfWork.handle(), configuration);
        });
    }

    public AggregateEventStream persist(EventStoreUnitOfWork unitOfWork,
                                        AggregateType aggregateType,
                                        String aggregateId,
                                        EventOrder expectedVersion,
                                        List<?> events,
                                        EventMetaData metaData) {
        requireNonNull(unitOfWork, "No unitOfWork provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedVersion, "No expectedVersion provided");
        requireNonNull(events, "No events provided");
        requireNonNull(metaData, "No metaData provided");
        requireTrue(!events.isEmpty(), msg("[{}] Cannot append an empty list of events to aggregate '{}'", aggregateType, aggregateId));
        requireTrue(expectedVersion.longValue() >= EventOrder.NO_EVENTS_PERSISTED.longValue(),
                    msg("[{}] Invalid expected version {}", aggregateType, expectedVersion));

        var configuration = getAggregateTypeConfiguration(aggregateType);
        var handle        = unitOfWork.handle();

        lockEventStreamTable(handle, configuration);
        var actualVersion = lastEventOrder(handle, configuration, aggregateId);
        if (!actualVersion.equals(expectedVersion)) {
            log.debug("[{}] Rejecting append to '{}': expected version {} but actual version {}",
                      aggregateType, aggregateId, expectedVersion, actualVersion);
            throw new OptimisticAppendToStreamException(aggregateType, aggregateId, expectedVersion, actualVersion, null);
        }

        var committedAt     = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
        var serializedMeta  = configuration.jsonSerializer.serialize(metaData);
        var nextEventOrder  = expectedVersion;
        var persistedEvents = new ArrayList<PersistedEvent>(events.size());
        for (Object event : events) {
            nextEventOrder = nextEventOrder.increaseAndGet();
            var registration = configuration.registrationFor(event);
            var eventId      = EventId.random();
            var json         = configuration.jsonSerializer.serialize(event);
            var globalOrder = insertEvent(handle, configuration, aggregateId, expectedVersion, nextEventOrder, eventId, registration, committedAt, json, serializedMeta);
            persistedEvents.add(PersistedEvent.from(eventId,
                                                    aggregateType,
                                                    aggregateId,
                                                    EventJSON.fromDeserialized(configuration.jsonSerializer, registration.eventType, event, json),
                                                    nextEventOrder,
                                                    registration.revision,
                                                    globalOrder,
                                                    metaData,
                                                    committedAt));
        }
        unitOfWork.registerEventsPersisted(persistedEvents);
        log.debug("[{}] Appended {} event(s) to '{}' with event order {}-{}",
                  aggregateType, events.size(), aggregateId, expectedVersion.longValue() + 1, nextEventOrder);
        return AggregateEventStream.of(aggregateType,
                                       aggregateId,
                                       LongRange.between(expectedVersion.longValue() + 1, nextEventOrder.longValue()),
                                       persistedEvents);
    }

    private GlobalEventOrder insertEvent(Handle handle,
                                         AggregateTypeConfiguration configuration,
                                         String aggregateId,
                                         EventOrder expectedVersion,
                                         EventOrder eventOrder,
                                         EventId eventId,
                                         AggregateTypeConfiguration.Registration registration,
                                         OffsetDateTime committedAt,
                                         String json,
                                         String serializedMetaData) {
        try {
            var globalOrder = handle.createQuery(getInsertSql(configuration))
                                    .bind("aggregateId", aggregateId)
                                    .bind("eventOrder", eventOrder.longValue())
                                    .bind("eventId", eventId.toString())
                                    .bind("eventType", registration.eventType.toString())
                                    .bind("eventRevision", registration.revision.intValue())
                                    .bind("committedAt", committedAt)
                                    .bind("eventPayload", json)
                                    .bind("eventMetaData", serializedMetaData)
                                    .mapTo(Long.class)
                                    .one();
            return GlobalEventOrder.of(globalOrder);
        } catch (StatementException e) {
            if (isEventOrderUniqueViolation(e)) {
                throw new OptimisticAppendToStreamException(configuration.aggregateType, aggregateId, expectedVersion, null, e);
            }
            throw new AppendToStreamException(msg("[{}] Failed to append event '{}' with event order {} to aggregate '{}'",
                                                  configuration.aggregateType,
                                                  registration.eventType,
                                                  eventOrder,
                                                  aggregateId),
                                              e);
        }
    }

    private static boolean isEventOrderUniqueViolation(Exception e) {
        var rootCause = Exceptions.getRootCause(e);
        return rootCause instanceof SQLException &&
                UNIQUE_VIOLATION_SQL_STATE.equals(((SQLException) rootCause).getSQLState()) &&
                String.valueOf(rootCause.getMessage()).contains(EVENT_ORDER_CONSTRAINT_INFIX);
    }

    private String getInsertSql(AggregateTypeConfiguration configuration) {
        return insertSql.computeIfAbsent(configuration.aggregateType,
                                         aggregateType -> bind("INSERT INTO {:tableName} (\n" +
                                                                       "    aggregate_id, event_order, event_id, event_type, event_revision, committed_at, event_payload, event_metadata\n" +
                                                                       ") VALUES (\n" +
                                                                       "    :aggregateId, :eventOrder, :eventId, :eventType, :eventRevision, :committedAt,\n" +
                                                                       "    CAST(:eventPayload AS jsonb), CAST(:eventMetaData AS jsonb)\n" +
                                                                       ") RETURNING global_order",
                                                               arg("tableName", configuration.eventStreamTableName)));
    }

    private void lockEventStreamTable(Handle handle, AggregateTypeConfiguration configuration) {
        handle.createQuery("SELECT count(*) FROM (SELECT pg_advisory_xact_lock(hashtext(:lockName))) AS l")
              .bind("lockName", configuration.eventStreamTableName)
              .mapTo(Long.class)
              .one();
    }

    private EventOrder lastEventOrder(Handle handle, AggregateTypeConfiguration configuration, String aggregateId) {
        return handle.createQuery(bind("SELECT COALESCE(MAX(event_order), 0) FROM {:tableName} WHERE aggregate_id = :aggregateId",
                                       arg("tableName", configuration.eventStreamTableName)))
                     .bind("aggregateId", aggregateId)
                     .mapTo(Long.class)
                     .map(EventOrder::of)
                     .one();
    }

    public Optional<AggregateEventStream> loadAggregateEvents(EventStoreUnitOfWork unitOfWork,
                                                              AggregateType aggregateType,
                                                              String aggregateId) {
        requireNonNull(unitOfWork, "No unitOfWork provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        var events = unitOfWork.handle()
                               .createQuery(bind("SELECT * FROM {:tableName} WHERE aggregate_id = :aggregateId ORDER BY event_order ASC",
                                                 arg("tableName", configuration.eventStreamTableName)))
                               .bind("aggregateId", aggregateId)
                               .map(new PersistedEventRowMapper(configuration))
                               .list();
        if (events.isEmpty()) {
            return Optional.empty();
        }
        verifyContiguousEventOrder(configuration, aggregateId, events);
        return Optional.of(AggregateEventStream.of(aggregateType,
                                                   aggregateId,
                                                   LongRange.between(EventOrder.FIRST_EVENT_ORDER.longValue(), events.size()),
                                                   events));
    }

    private static void verifyContiguousEventOrder(AggregateTypeConfiguration configuration, String aggregateId, List<PersistedEvent> events) {
        for (int index = 0; index < events.size(); index++) {
            var expectedEventOrder = index + 1L;
            if (events.get(index).eventOrder().longValue() != expectedEventOrder) {
                throw new EventStoreException(msg("[{}] Event stream of aggregate '{}' is corrupt. Expected event order {} but found {}",
                                                  configuration.aggregateType,
                                                  aggregateId,
                                                  expectedEventOrder,
                                                  events.get(index).eventOrder()));
            }
        }
    }

    public Optional<PersistedEvent> loadLastPersistedEventRelatedTo(EventStoreUnitOfWork unitOfWork,
                                                                    AggregateType aggregateType,
                                                                    String aggregateId) {
        var configuration = getAggregateTypeConfiguration(aggregateType);
        return unitOfWork.handle()
                         .createQuery(bind("SELECT * FROM {:tableName} WHERE aggregate_id = :aggregateId ORDER BY event_order DESC LIMIT 1",
                                           arg("tableName", configuration.eventStreamTableName)))
                         .bind("aggregateId", requireNonNull(aggregateId, "No aggregateId provided"))
                         .map(new PersistedEventRowMapper(configuration))
                         .findOne();
    }

    public List<PersistedEvent> loadEventsByGlobalOrder(EventStoreUnitOfWork unitOfWork,
                                                        AggregateType aggregateType,
                                                        LongRange globalOrderRange) {
        requireNonNull(globalOrderRange, "No globalOrderRange provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        Query query;
        if (globalOrderRange.isClosedRange()) {
            query = unitOfWork.handle()
                              .createQuery(bind("SELECT * FROM {:tableName} WHERE global_order >= :fromInclusive AND global_order <= :toInclusive ORDER BY global_order ASC",
                                                arg("tableName", configuration.eventStreamTableName)))
                              .bind("fromInclusive", globalOrderRange.fromInclusive)
                              .bind("toInclusive", globalOrderRange.toInclusive);
        } else {
            query = unitOfWork.handle()
                              .createQuery(bind("SELECT * FROM {:tableName} WHERE global_order >= :fromInclusive ORDER BY global_order ASC",
                                                arg("tableName", configuration.eventStreamTableName)))
                              .bind("fromInclusive", globalOrderRange.fromInclusive);
        }
        return query.map(new PersistedEventRowMapper(configuration)).list();
    }

    /**
     * Load at most <code>batchSize</code> events with a global order strictly greater than <code>afterGlobalOrder</code>.<br>
     * Unlike a closed {@link LongRange} this isn't affected by gaps in the global order.
     */
    public List<PersistedEvent> loadEventsAfterGlobalOrder(EventStoreUnitOfWork unitOfWork,
                                                           AggregateType aggregateType,
                                                           GlobalEventOrder afterGlobalOrder,
                                                           int batchSize) {
        requireNonNull(afterGlobalOrder, "No afterGlobalOrder provided");
        requireTrue(batchSize > 0, "batchSize must be > 0");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        return unitOfWork.handle()
                         .createQuery(bind("SELECT * FROM {:tableName} WHERE global_order > :afterGlobalOrder ORDER BY global_order ASC LIMIT :batchSize",
                                           arg("tableName", configuration.eventStreamTableName)))
                         .bind("afterGlobalOrder", afterGlobalOrder.longValue())
                         .bind("batchSize", batchSize)
                         .map(new PersistedEventRowMapper(configuration))
                         .list();
    }

    public GlobalEventOrder highestGlobalEventOrder(EventStoreUnitOfWork unitOfWork, AggregateType aggregateType) {
        var configuration = getAggregateTypeConfiguration(aggregateType);
        return unitOfWork.handle()
                         .createQuery(bind("SELECT COALESCE(MAX(global_order), 0) FROM {:tableName}",
                                           arg("tableName", configuration.eventStreamTableName)))
                         .mapTo(Long.class)
                         .map(GlobalEventOrder::of)
                         .one();
    }
}
