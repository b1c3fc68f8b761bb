package dk.cloudcreate.imkitchen.common.transaction;

/**
 * A unit of work wraps exactly one database transaction.<br>
 * Command handlers append events and write their side tables inside one {@link UnitOfWork},
 * and projections advance their cursor inside the same {@link UnitOfWork} that mutates their read model,
 * so either everything in it becomes visible or nothing does.
 */
public interface UnitOfWork {
    /**
     * Start the {@link UnitOfWork} and the underlying transaction
     */
    void start();

    /**
     * Commit the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#Committed}.<br>
     * If the {@link UnitOfWork} has been marked as rollback only, then it will be rolled back instead
     */
    void commit();

    /**
     * Roll back the {@link UnitOfWork} and the underlying transaction - see {@link UnitOfWorkStatus#RolledBack}
     *
     * @param cause the cause of the rollback (may be null)
     */
    void rollback(Exception cause);

    /**
     * Roll back using any cause registered using {@link #markAsRollbackOnly(Exception)}
     */
    default void rollback() {
        rollback(getCauseOfRollback());
    }

    UnitOfWorkStatus status();

    /**
     * The cause of a Rollback or a {@link #markAsRollbackOnly(Exception)}
     */
    Exception getCauseOfRollback();

    default void markAsRollbackOnly() {
        markAsRollbackOnly(null);
    }

    /**
     * Mark the {@link UnitOfWork} so that the only possible outcome is a rollback.<br>
     * Used by nested {@link UnitOfWorkFactory#usingUnitOfWork(dk.cloudcreate.essentials.shared.functional.CheckedConsumer)} calls
     * that fail while reusing a {@link UnitOfWork} they didn't create
     *
     * @param cause the cause
     */
    void markAsRollbackOnly(Exception cause);
}
