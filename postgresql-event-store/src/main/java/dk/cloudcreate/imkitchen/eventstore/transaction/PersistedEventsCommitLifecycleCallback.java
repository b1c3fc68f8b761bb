package dk.cloudcreate.imkitchen.eventstore.transaction;

import dk.cloudcreate.imkitchen.common.transaction.UnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;

import java.util.List;

/**
 * Callback registered with the {@link EventStoreUnitOfWorkFactory}. It is called for every {@link UnitOfWork}
 * that persisted at least one event.
 */
public interface PersistedEventsCommitLifecycleCallback {
    /**
     * Called right before the transaction commits. Throwing an exception rolls the {@link UnitOfWork} back
     */
    default void beforeCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents) {
    }

    /**
     * Called after the transaction committed, i.e. when the events are visible to other transactions
     */
    void afterCommit(UnitOfWork unitOfWork, List<PersistedEvent> persistedEvents);
}
