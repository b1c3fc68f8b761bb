package dk.cloudcreate.imkitchen.eventstore.eventstream;

import java.util.*;

/**
 * Free form metadata stored alongside every persisted event, e.g. the correlation id of the request that caused the command
 */
public class EventMetaData extends HashMap<String, String> {
    public static final String CORRELATION_ID = "correlation_id";
    public static final String CAUSED_BY      = "caused_by";

    public EventMetaData() {
    }

    public EventMetaData(Map<String, String> metaData) {
        super(metaData);
    }

    public static EventMetaData empty() {
        return new EventMetaData();
    }

    public static EventMetaData of(String key, String value) {
        var metaData = new EventMetaData();
        metaData.put(key, value);
        return metaData;
    }

    public static EventMetaData of(String key1, String value1, String key2, String value2) {
        var metaData = of(key1, value1);
        metaData.put(key2, value2);
        return metaData;
    }

    public EventMetaData with(String key, String value) {
        var metaData = new EventMetaData(this);
        metaData.put(key, value);
        return metaData;
    }

    public Optional<String> correlationId() {
        return Optional.ofNullable(get(CORRELATION_ID));
    }
}
