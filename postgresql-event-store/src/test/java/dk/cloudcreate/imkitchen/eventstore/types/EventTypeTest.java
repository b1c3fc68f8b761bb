package dk.cloudcreate.imkitchen.eventstore.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EventTypeTest {
    @Test
    void test_creating_an_EventType_from_a_logical_name() {
        // When
        var eventType = EventType.of("RecipeFavorited");

        // Then
        assertThat(eventType.toString()).isEqualTo("RecipeFavorited");
        assertThat((CharSequence) eventType).isEqualTo(EventType.of("RecipeFavorited"));
    }

    @Test
    void test_two_different_EventTypes_are_not_equal() {
        assertThat(EventType.of("RecipeCreated").equals(EventType.of("RecipeDeleted"))).isFalse();
    }

    @Test
    void test_an_EventType_name_must_start_with_a_letter_and_contain_no_separators() {
        assertThatThrownBy(() -> EventType.of("1RecipeCreated")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EventType.of("recipe.created")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EventType.of("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_EventOrder_increase_and_get_returns_the_next_event_order() {
        assertThat(EventOrder.NO_EVENTS_PERSISTED.increaseAndGet()).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
        assertThat(EventOrder.of(41).increaseAndGet()).isEqualTo(EventOrder.of(42));
        assertThat(GlobalEventOrder.NONE.next()).isEqualTo(GlobalEventOrder.FIRST_GLOBAL_EVENT);
    }
}
