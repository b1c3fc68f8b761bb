package dk.cloudcreate.imkitchen.projections;

public enum DeliveryMode {
    /**
     * Deliver the backlog and wait for cursor locks held by other deliveries
     */
    DRAIN,
    /**
     * Background delivery. A subscription whose cursor is locked by another instance is skipped for this round
     */
    CONTINUOUS;

    boolean skipLockedCursors() {
        return this == CONTINUOUS;
    }
}
