package dk.cloudcreate.imkitchen.eventstore.eventstream;

import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The serialized payload of a persisted event together with the information needed to deserialize it.<br>
 * Deserialization is lazy and the result is cached, so handlers that aren't interested in an event never pay for it.
 */
public class EventJSON {
    private final JSONSerializer jsonSerializer;
    private final EventType      eventType;
    private final Class<?>       javaType;
    private final String         json;
    private       Object         jsonDeserialized;

    public EventJSON(JSONSerializer jsonSerializer, EventType eventType, Class<?> javaType, String json) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.javaType = requireNonNull(javaType, "No javaType provided");
        this.json = requireNonNull(json, "No json provided");
    }

    /**
     * Wrap an already deserialized event (used for events that were just persisted)
     */
    public static EventJSON fromDeserialized(JSONSerializer jsonSerializer, EventType eventType, Object event, String json) {
        var eventJSON = new EventJSON(jsonSerializer, eventType, requireNonNull(event, "No event provided").getClass(), json);
        eventJSON.jsonDeserialized = event;
        return eventJSON;
    }

    public EventType eventType() {
        return eventType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    public String getJson() {
        return json;
    }

    @SuppressWarnings("unchecked")
    public <T> T deserialize() {
        if (jsonDeserialized == null) {
            jsonDeserialized = jsonSerializer.deserialize(json, javaType);
        }
        return (T) jsonDeserialized;
    }

    /**
     * Deserialize the payload if its Java type is compatible with <code>requiredType</code>
     */
    public <T> Optional<T> deserializeAs(Class<T> requiredType) {
        requireNonNull(requiredType, "No requiredType provided");
        if (!requiredType.isAssignableFrom(javaType)) {
            return Optional.empty();
        }
        return Optional.of(requiredType.cast(deserialize()));
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType=" + eventType +
                ", javaType=" + javaType.getName() +
                ", json='" + json + '\'' +
                '}';
    }
}
