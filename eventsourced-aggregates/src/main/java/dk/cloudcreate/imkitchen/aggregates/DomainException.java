package dk.cloudcreate.imkitchen.aggregates;

/**
 * A command was rejected by a business rule. No events are appended when a command fails with a {@link DomainException}.
 *
 * @see InvalidStateException
 * @see LimitExceededException
 * @see ConstraintViolationException
 */
public abstract class DomainException extends RuntimeException {
    protected DomainException(String message) {
        super(message);
    }

    protected DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
