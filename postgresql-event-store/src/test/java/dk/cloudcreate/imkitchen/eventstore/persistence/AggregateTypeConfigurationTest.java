package dk.cloudcreate.imkitchen.eventstore.persistence;

import dk.cloudcreate.imkitchen.eventstore.EventStoreException;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.serializer.JacksonJSONSerializer;
import dk.cloudcreate.imkitchen.eventstore.test_data.*;
import dk.cloudcreate.imkitchen.eventstore.types.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AggregateTypeConfigurationTest {
    private final JacksonJSONSerializer jsonSerializer = new JacksonJSONSerializer();

    @Test
    void standard_configuration_uses_the_lower_cased_aggregate_type_as_table_prefix() {
        var configuration = AggregateTypeConfiguration.standardConfigurationFor(AggregateType.of("MealPlans"), jsonSerializer);

        assertThat(configuration.eventStreamTableName).isEqualTo("mealplans_events");
    }

    @Test
    void table_names_that_could_be_used_for_sql_injection_are_rejected() {
        assertThatThrownBy(() -> new AggregateTypeConfiguration(AggregateType.of("Pantries"), "pantries; DROP TABLE users", jsonSerializer))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void registrations_resolve_both_from_event_instance_and_event_type() {
        // Given
        var configuration = PantryEvents.configuration(jsonSerializer);
        var event         = new PantryEvents.PantryOpened(PantryId.random(), "alice", List.of("top"), Instant.now());

        // When
        var byInstance  = configuration.registrationFor(event);
        var byEventType = configuration.registrationFor(EventType.of("PantryOpened"));

        // Then
        assertThat(byInstance).isSameAs(byEventType);
        assertThat(byInstance.javaType).isEqualTo(PantryEvents.PantryOpened.class);
        assertThat(byInstance.revision).isEqualTo(EventRevision.FIRST);
        assertThat(configuration.registeredEventTypes()).containsExactlyInAnyOrder(EventType.of("PantryOpened"), EventType.of("ItemStocked"));
    }

    @Test
    void unregistered_events_and_unknown_event_types_are_rejected() {
        var configuration = PantryEvents.configuration(jsonSerializer);

        assertThatThrownBy(() -> configuration.registrationFor(new PantryEvents.PantryClosed(PantryId.random())))
                .isExactlyInstanceOf(EventStoreException.class);
        assertThatThrownBy(() -> configuration.registrationFor(EventType.of("PantryClosed")))
                .isExactlyInstanceOf(EventStoreException.class);
    }

    @Test
    void an_event_type_name_cannot_be_registered_for_two_different_classes() {
        var configuration = PantryEvents.configuration(jsonSerializer);

        assertThatThrownBy(() -> configuration.registerEventType("PantryOpened", PantryEvents.PantryClosed.class))
                .isExactlyInstanceOf(EventStoreException.class);
    }
}
