package dk.cloudcreate.imkitchen.common.transaction;

/**
 * Thrown by {@link UnitOfWorkFactory#getRequiredUnitOfWork()} when the calling thread isn't
 * associated with an active {@link UnitOfWork}
 */
public class NoActiveUnitOfWorkException extends UnitOfWorkException {
    public NoActiveUnitOfWorkException() {
        super("No active UnitOfWork is associated with the current thread");
    }

    public NoActiveUnitOfWorkException(String message) {
        super(message);
    }
}
