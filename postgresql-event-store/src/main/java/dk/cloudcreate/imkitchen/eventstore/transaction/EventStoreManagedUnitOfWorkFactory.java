package dk.cloudcreate.imkitchen.eventstore.transaction;

import dk.cloudcreate.imkitchen.common.transaction.*;
import dk.cloudcreate.imkitchen.eventstore.eventstream.PersistedEvent;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStoreUnitOfWorkFactory} where the event store manages the {@link UnitOfWork} and the underlying database transaction itself
 */
public class EventStoreManagedUnitOfWorkFactory extends GenericHandleAwareUnitOfWorkFactory<EventStoreUnitOfWork> implements EventStoreUnitOfWorkFactory {
    private final List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks;

    public EventStoreManagedUnitOfWorkFactory(Jdbi jdbi) {
        super(jdbi);
        lifecycleCallbacks = new CopyOnWriteArrayList<>();
    }

    @Override
    protected EventStoreUnitOfWork createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<EventStoreUnitOfWork> unitOfWorkFactory) {
        return new EventStoreManagedUnitOfWork(unitOfWorkFactory, lifecycleCallbacks);
    }

    @Override
    public EventStoreUnitOfWorkFactory registerPersistedEventsCommitLifeCycleCallback(PersistedEventsCommitLifecycleCallback callback) {
        lifecycleCallbacks.add(requireNonNull(callback, "No callback provided"));
        return this;
    }

    private static class EventStoreManagedUnitOfWork extends GenericHandleAwareUnitOfWork implements EventStoreUnitOfWork {
        private static final Logger log = LoggerFactory.getLogger(EventStoreManagedUnitOfWork.class);

        private final List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks;
        private final List<PersistedEvent>                         eventsPersisted;

        EventStoreManagedUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory, List<PersistedEventsCommitLifecycleCallback> lifecycleCallbacks) {
            super(unitOfWorkFactory);
            this.lifecycleCallbacks = requireNonNull(lifecycleCallbacks, "No lifecycleCallbacks provided");
            this.eventsPersisted = new ArrayList<>();
        }

        @Override
        public void registerEventsPersisted(List<PersistedEvent> eventsPersistedInThisUnitOfWork) {
            requireNonNull(eventsPersistedInThisUnitOfWork, "No eventsPersistedInThisUnitOfWork provided");
            this.eventsPersisted.addAll(eventsPersistedInThisUnitOfWork);
        }

        @Override
        protected void beforeCommitting() {
            if (eventsPersisted.isEmpty()) {
                return;
            }
            for (var callback : lifecycleCallbacks) {
                try {
                    log.trace("BeforeCommit for {} with {} persisted events", callback.getClass().getName(), eventsPersisted.size());
                    callback.beforeCommit(this, Collections.unmodifiableList(eventsPersisted));
                } catch (RuntimeException e) {
                    throw new UnitOfWorkException(msg("{} failed during beforeCommit", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        protected void afterCommitting() {
            if (eventsPersisted.isEmpty()) {
                return;
            }
            var committedEvents = List.copyOf(eventsPersisted);
            for (var callback : lifecycleCallbacks) {
                try {
                    log.trace("AfterCommit for {} with {} persisted events", callback.getClass().getName(), committedEvents.size());
                    callback.afterCommit(this, committedEvents);
                } catch (RuntimeException e) {
                    // The transaction is already committed, so a failing callback must not fail the caller
                    log.error(msg("{} failed during afterCommit", callback.getClass().getName()), e);
                }
            }
        }

        @Override
        protected void afterRollback(Exception cause) {
            if (!eventsPersisted.isEmpty()) {
                log.debug("Discarding {} events persisted in a UnitOfWork that was rolled back", eventsPersisted.size());
                eventsPersisted.clear();
            }
        }
    }
}
