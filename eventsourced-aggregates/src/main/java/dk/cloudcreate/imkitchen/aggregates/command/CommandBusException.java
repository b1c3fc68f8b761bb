package dk.cloudcreate.imkitchen.aggregates.command;

public class CommandBusException extends RuntimeException {
    public CommandBusException(String message) {
        super(message);
    }

    public CommandBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
