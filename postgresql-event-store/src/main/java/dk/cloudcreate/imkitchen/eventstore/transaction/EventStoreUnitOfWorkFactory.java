package dk.cloudcreate.imkitchen.eventstore.transaction;

import dk.cloudcreate.imkitchen.common.transaction.UnitOfWorkFactory;

public interface EventStoreUnitOfWorkFactory extends UnitOfWorkFactory<EventStoreUnitOfWork> {
    /**
     * Register a callback that is notified about the events persisted in every {@link EventStoreUnitOfWork}
     *
     * @param callback the callback to register
     * @return this factory
     */
    EventStoreUnitOfWorkFactory registerPersistedEventsCommitLifeCycleCallback(PersistedEventsCommitLifecycleCallback callback);
}
