package dk.cloudcreate.imkitchen.eventstore.serializer;

import dk.cloudcreate.imkitchen.eventstore.eventstream.EventMetaData;
import dk.cloudcreate.imkitchen.eventstore.test_data.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class JacksonJSONSerializerTest {
    private final JacksonJSONSerializer jsonSerializer = new JacksonJSONSerializer();

    @Test
    void ids_are_serialized_as_plain_strings_and_instants_as_iso_8601() {
        // Given
        var pantryId = PantryId.of("pantry-1");
        var event    = new PantryEvents.PantryOpened(pantryId, "alice", List.of("top", "bottom"), Instant.parse("2025-01-06T10:15:30Z"));

        // When
        var json = jsonSerializer.serialize(event);

        // Then
        assertThat(json).contains("\"pantryId\":\"pantry-1\"");
        assertThat(json).contains("\"openedAt\":\"2025-01-06T10:15:30Z\"");
        var deserialized = jsonSerializer.deserialize(json, PantryEvents.PantryOpened.class);
        assertThat(deserialized).usingRecursiveComparison().isEqualTo(event);
    }

    @Test
    void unknown_properties_written_by_newer_event_revisions_are_ignored() {
        var json = "{\"pantryId\":\"pantry-1\",\"item\":\"flour\",\"quantity\":2,\"addedInRevision2\":true}";

        var event = jsonSerializer.deserialize(json, PantryEvents.ItemStocked.class);

        assertThat(event.item).isEqualTo("flour");
        assertThat(event.quantity).isEqualTo(2);
    }

    @Test
    void event_metadata_is_a_plain_json_object() {
        var metaData = EventMetaData.of(EventMetaData.CORRELATION_ID, "c-1");

        var json = jsonSerializer.serialize(metaData);

        assertThat(json).isEqualTo("{\"correlation_id\":\"c-1\"}");
        assertThat(jsonSerializer.deserialize(json, EventMetaData.class).correlationId()).contains("c-1");
    }

    @Test
    void malformed_json_raises_a_JSONDeserializationException() {
        assertThatThrownBy(() -> jsonSerializer.deserialize("{not json", PantryEvents.ItemStocked.class))
                .isInstanceOf(JSONDeserializationException.class);
    }
}
