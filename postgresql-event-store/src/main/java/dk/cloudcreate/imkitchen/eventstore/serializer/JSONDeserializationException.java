package dk.cloudcreate.imkitchen.eventstore.serializer;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
