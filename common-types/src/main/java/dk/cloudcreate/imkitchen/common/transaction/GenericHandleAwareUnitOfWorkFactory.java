package dk.cloudcreate.imkitchen.common.transaction;

import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link UnitOfWorkFactory} that manages the Jdbi {@link Handle} and database transaction of each {@link UnitOfWork} itself
 * and binds the active {@link UnitOfWork} to the calling thread.<br>
 * Subclasses decide which concrete {@link HandleAwareUnitOfWork} type to create and can hook into the commit and rollback phases
 * through {@link GenericHandleAwareUnitOfWork}.
 *
 * @param <UOW> the concrete {@link HandleAwareUnitOfWork} type
 */
public abstract class GenericHandleAwareUnitOfWorkFactory<UOW extends HandleAwareUnitOfWork> implements UnitOfWorkFactory<UOW> {
    private static final Logger log = LoggerFactory.getLogger(GenericHandleAwareUnitOfWorkFactory.class);

    private final Jdbi             jdbi;
    private final ThreadLocal<UOW> unitsOfWork = new ThreadLocal<>();

    protected GenericHandleAwareUnitOfWorkFactory(Jdbi jdbi) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
    }

    public Jdbi getJdbi() {
        return jdbi;
    }

    protected abstract UOW createNewUnitOfWorkInstance(GenericHandleAwareUnitOfWorkFactory<UOW> unitOfWorkFactory);

    @Override
    public UOW getRequiredUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            throw new NoActiveUnitOfWorkException();
        }
        return unitOfWork;
    }

    @Override
    public UOW getOrCreateNewUnitOfWork() {
        var unitOfWork = unitsOfWork.get();
        if (unitOfWork == null) {
            unitOfWork = createNewUnitOfWorkInstance(this);
            unitOfWork.start();
            unitsOfWork.set(unitOfWork);
        }
        return unitOfWork;
    }

    @Override
    public Optional<UOW> getCurrentUnitOfWork() {
        return Optional.ofNullable(unitsOfWork.get());
    }

    protected void removeUnitOfWork() {
        unitsOfWork.remove();
    }

    /**
     * Base {@link HandleAwareUnitOfWork} that owns one Jdbi {@link Handle} for the lifetime of the transaction
     */
    public static class GenericHandleAwareUnitOfWork implements HandleAwareUnitOfWork {
        private final GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory;
        private       Handle                                 handle;
        private       UnitOfWorkStatus                       status;
        private       Exception                              causeOfRollback;

        public GenericHandleAwareUnitOfWork(GenericHandleAwareUnitOfWorkFactory<?> unitOfWorkFactory) {
            this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
            this.status = UnitOfWorkStatus.Ready;
        }

        @Override
        public void start() {
            if (status == UnitOfWorkStatus.Started) {
                log.warn("The UnitOfWork was already started");
                return;
            }
            if (status != UnitOfWorkStatus.Ready) {
                throw new UnitOfWorkException(msg("Cannot start a UnitOfWork with status {}", status));
            }
            handle = unitOfWorkFactory.jdbi.open();
            handle.begin();
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            if (status == UnitOfWorkStatus.MarkedForRollbackOnly) {
                log.debug("UnitOfWork is marked as rollback only, rolling back instead of committing");
                rollback(causeOfRollback);
                return;
            }
            if (status != UnitOfWorkStatus.Started) {
                throw new UnitOfWorkException(msg("Cannot commit a UnitOfWork with status {}", status));
            }
            beforeCommitting();
            try {
                handle.commit();
            } catch (RuntimeException e) {
                rollback(e);
                throw new UnitOfWorkException("Failed to commit the UnitOfWork", e);
            }
            status = UnitOfWorkStatus.Committed;
            close();
            afterCommitting();
        }

        @Override
        public void rollback(Exception cause) {
            if (status.isCompleted()) {
                log.debug("Ignoring rollback of a UnitOfWork with status {}", status);
                return;
            }
            causeOfRollback = cause != null ? cause : causeOfRollback;
            try {
                if (handle != null) {
                    handle.rollback();
                }
            } finally {
                status = UnitOfWorkStatus.RolledBack;
                close();
            }
            afterRollback(causeOfRollback);
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            if (status.isCompleted()) {
                throw new UnitOfWorkException(msg("Cannot mark a UnitOfWork with status {} as rollback only", status));
            }
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }

        @Override
        public Handle handle() {
            if (handle == null || status.isCompleted()) {
                throw new UnitOfWorkException(msg("The UnitOfWork doesn't have an active handle. Status {}", status));
            }
            return handle;
        }

        private void close() {
            unitOfWorkFactory.removeUnitOfWork();
            if (handle != null) {
                try {
                    handle.close();
                } catch (RuntimeException e) {
                    log.error("Failed to close the Jdbi handle", e);
                }
            }
        }

        /**
         * Called before the database transaction is committed. An exception thrown here aborts the commit
         */
        protected void beforeCommitting() {
        }

        /**
         * Called after the database transaction was committed and the handle closed
         */
        protected void afterCommitting() {
        }

        /**
         * Called after the database transaction was rolled back and the handle closed
         *
         * @param cause the cause of the rollback (may be null)
         */
        protected void afterRollback(Exception cause) {
        }
    }
}
