package dk.cloudcreate.imkitchen.eventstore;

/**
 * The database backing the event store (and the read models) couldn't be reached.<br>
 * The in-flight operation failed and had no effect; callers may retry according to their own retry/backoff policy.
 */
public class EventStoreUnavailableException extends EventStoreException {
    public EventStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
