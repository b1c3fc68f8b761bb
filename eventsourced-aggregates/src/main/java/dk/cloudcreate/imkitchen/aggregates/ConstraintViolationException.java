package dk.cloudcreate.imkitchen.aggregates;

/**
 * The command's input violates a validation rule (e.g. an invalid email or a start date that isn't a Monday)
 */
public class ConstraintViolationException extends DomainException {
    public ConstraintViolationException(String message) {
        super(message);
    }
}
