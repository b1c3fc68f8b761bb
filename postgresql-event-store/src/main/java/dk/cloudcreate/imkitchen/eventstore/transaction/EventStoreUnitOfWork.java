package dk.cloudcreate.imkitchen.eventstore.transaction;

import dk.cloudcreate.imkitchen.common.transaction.HandleAwareUnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;

import java.util.List;

/**
 * {@link HandleAwareUnitOfWork} that collects the events appended during the unit of work, so they can be handed to the
 * registered {@link PersistedEventsCommitLifecycleCallback}'s once the transaction commits
 */
public interface EventStoreUnitOfWork extends HandleAwareUnitOfWork {
    void registerEventsPersisted(List<PersistedEvent> eventsPersistedInThisUnitOfWork);
}
