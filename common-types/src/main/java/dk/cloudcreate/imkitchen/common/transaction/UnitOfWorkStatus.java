package dk.cloudcreate.imkitchen.common.transaction;

/**
 * The status of a {@link UnitOfWork}
 */
public enum UnitOfWorkStatus {
    /**
     * Created, but the underlying transaction hasn't begun
     */
    Ready(false),
    /**
     * The underlying database transaction has begun
     */
    Started(false),
    /**
     * The work was committed and the handle closed
     */
    Committed(true),
    /**
     * The work was rolled back and the handle closed
     */
    RolledBack(true),
    /**
     * The transaction is still open, but it can only end in a rollback
     */
    MarkedForRollbackOnly(false);

    public final boolean isCompleted;

    UnitOfWorkStatus(boolean isCompleted) {
        this.isCompleted = isCompleted;
    }

    public boolean isCompleted() {
        return isCompleted;
    }
}
