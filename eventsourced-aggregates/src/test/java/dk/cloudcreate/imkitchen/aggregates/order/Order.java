package dk.cloudcreate.imkitchen.aggregates.order;

import dk.cloudcreate.imkitchen.aggregates.EventSourcedAggregate;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;

import java.util.HashMap;

public class Order implements EventSourcedAggregate<OrderId, OrderEvent, OrderState> {
    @Override
    public AggregateType aggregateType() {
        return OrderEvent.ORDERS;
    }

    @Override
    public Class<OrderEvent> eventType() {
        return OrderEvent.class;
    }

    @Override
    public OrderState initialState() {
        return OrderState.NOT_CREATED;
    }

    @Override
    public OrderState apply(OrderState state, OrderEvent event) {
        if (event instanceof OrderEvent.OrderAdded) {
            return new OrderState(event.orderId, state.productAndQuantity, false);
        }
        if (event instanceof OrderEvent.ProductAddedToOrder) {
            var e        = (OrderEvent.ProductAddedToOrder) event;
            var products = new HashMap<>(state.productAndQuantity);
            products.merge(e.product, e.quantity, Integer::sum);
            return new OrderState(state.orderId, products, state.accepted);
        }
        if (event instanceof OrderEvent.OrderAccepted) {
            return new OrderState(state.orderId, state.productAndQuantity, true);
        }
        throw new IllegalArgumentException("Unsupported event " + event.getClass().getName());
    }
}
