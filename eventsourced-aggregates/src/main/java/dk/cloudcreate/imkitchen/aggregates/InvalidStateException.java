package dk.cloudcreate.imkitchen.aggregates;

/**
 * The command isn't allowed in the aggregate's current state, e.g. favoriting a deleted recipe
 */
public class InvalidStateException extends DomainException {
    public InvalidStateException(String message) {
        super(message);
    }
}
