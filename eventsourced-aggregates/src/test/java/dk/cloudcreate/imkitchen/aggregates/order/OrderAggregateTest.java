package dk.cloudcreate.imkitchen.aggregates.order;

import dk.cloudcreate.imkitchen.aggregates.*;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EventSourcedAggregate folding and decisions")
class OrderAggregateTest {
    private final Order order = new Order();

    @Test
    void rehydrating_the_same_events_always_yields_the_same_state() {
        // Given
        var orderId = OrderId.random();
        var events = List.<OrderEvent>of(new OrderEvent.OrderAdded(orderId, "alice", 123),
                                         new OrderEvent.ProductAddedToOrder(orderId, "flour", 2),
                                         new OrderEvent.ProductAddedToOrder(orderId, "flour", 1),
                                         new OrderEvent.OrderAccepted(orderId));

        // When
        var state1 = order.rehydrate(events);
        var state2 = order.rehydrate(new ArrayList<>(events));

        // Then
        assertThat(state1).isEqualTo(state2);
        assertThat(state1.productAndQuantity).containsEntry("flour", 3);
        assertThat(state1.accepted).isTrue();
    }

    @Test
    void rehydrating_no_events_yields_the_initial_state() {
        assertThat(order.rehydrate(List.of())).isSameAs(order.initialState());
        assertThat(order.initialState().exists()).isFalse();
    }

    @Test
    void an_accepted_order_rejects_new_products() {
        var orderId = OrderId.random();
        var state = order.rehydrate(List.of(new OrderEvent.OrderAdded(orderId, "alice", 1),
                                            new OrderEvent.OrderAccepted(orderId)));

        assertThatThrownBy(() -> state.addProduct("salt", 1))
                .isExactlyInstanceOf(InvalidStateException.class);
    }

    @Test
    void accepting_an_already_accepted_order_emits_no_events() {
        var orderId = OrderId.random();
        var state = order.rehydrate(List.of(new OrderEvent.OrderAdded(orderId, "alice", 1),
                                            new OrderEvent.OrderAccepted(orderId)));

        assertThat(state.accept()).isEmpty();
    }

    @Test
    void exceeding_the_product_limit_is_rejected_with_the_limit() {
        var orderId = OrderId.random();
        var state = order.rehydrate(List.of(new OrderEvent.OrderAdded(orderId, "alice", 1),
                                            new OrderEvent.ProductAddedToOrder(orderId, "a", 1),
                                            new OrderEvent.ProductAddedToOrder(orderId, "b", 1),
                                            new OrderEvent.ProductAddedToOrder(orderId, "c", 1)));

        assertThatThrownBy(() -> state.addProduct("d", 1))
                .isExactlyInstanceOf(LimitExceededException.class)
                .satisfies(e -> assertThat(((LimitExceededException) e).limit).isEqualTo(3));
        assertThat(state.addProduct("a", 5)).hasSize(1);
    }

    @Test
    void creating_with_an_invalid_order_number_is_a_constraint_violation() {
        assertThatThrownBy(() -> order.initialState().create(OrderId.random(), "alice", 0))
                .isExactlyInstanceOf(ConstraintViolationException.class);
    }
}
