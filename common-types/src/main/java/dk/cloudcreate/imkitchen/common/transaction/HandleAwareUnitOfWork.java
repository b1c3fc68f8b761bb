package dk.cloudcreate.imkitchen.common.transaction;

import org.jdbi.v3.core.Handle;

/**
 * Version of {@link UnitOfWork} that exposes the Jdbi {@link Handle} bound to its transaction
 */
public interface HandleAwareUnitOfWork extends UnitOfWork {
    /**
     * @return the {@link org.jdbi.v3.core.Jdbi} handle
     * @throws UnitOfWorkException If the transaction isn't active
     */
    Handle handle();
}
