package dk.cloudcreate.imkitchen.eventstore.serializer;

/**
 * Serializes event payloads and metadata to and from JSON
 */
public interface JSONSerializer {
    /**
     * @throws JSONSerializationException if serialization fails
     */
    String serialize(Object obj);

    /**
     * @throws JSONDeserializationException if deserialization fails
     */
    <T> T deserialize(String json, Class<T> javaType);
}
