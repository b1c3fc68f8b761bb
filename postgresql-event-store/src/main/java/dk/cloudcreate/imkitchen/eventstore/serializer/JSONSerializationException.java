package dk.cloudcreate.imkitchen.eventstore.serializer;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
