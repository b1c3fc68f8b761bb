package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String message) {
        super(message);
    }

    public AppendToStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
