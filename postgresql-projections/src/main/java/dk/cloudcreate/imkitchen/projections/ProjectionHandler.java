package dk.cloudcreate.imkitchen.projections;

import dk.cloudcreate.imkitchen.common.transaction.HandleAwareUnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import org.jdbi.v3.core.Handle;

import java.util.Set;

/**
 * Maintains one read model from the events of one or more {@link AggregateType}'s.<br>
 * <br>
 * A handler receives each event of each of its aggregate types exactly once per successful delivery, in global order,
 * but it must tolerate re-delivery of an event whose transaction failed to commit (e.g. the database connection was lost after
 * the read model writes). Writes are therefore expected to be idempotent upserts keyed by deterministic ids
 * (<code>INSERT ... ON CONFLICT ... DO UPDATE</code>), counters are recomputed instead of incremented, and stored timestamps come
 * from the event rather than the wall clock.<br>
 * <br>
 * {@link #apply(HandleAwareUnitOfWork, PersistedEvent)} runs in the same transaction that advances the projection's cursor,
 * so the read model rows and the cursor always commit together.
 */
public interface ProjectionHandler {
    /**
     * Unique and stable name of the projection. Used as part of the cursor key
     */
    String projectionName();

    /**
     * The aggregate types whose events this projection consumes. Each gets its own cursor
     */
    Set<AggregateType> aggregateTypes();

    /**
     * The logical event types {@link #apply(HandleAwareUnitOfWork, PersistedEvent)} is called for.
     * Other events only advance the cursor
     */
    Set<EventType> interestedEventTypes();

    void apply(HandleAwareUnitOfWork unitOfWork, PersistedEvent event);

    /**
     * Create the read model tables and indexes. Must be idempotent (<code>CREATE TABLE IF NOT EXISTS</code>)
     */
    void initializeReadModel(Handle handle);

    /**
     * Remove all rows from the tables owned by this projection. Used when rebuilding the projection
     */
    void resetReadModel(Handle handle);
}
