package dk.cloudcreate.imkitchen.aggregates.order;

import dk.cloudcreate.imkitchen.aggregates.*;

import java.util.*;

public final class OrderState {
    static final OrderState NOT_CREATED = new OrderState(null, Map.of(), false);

    public final OrderId              orderId;
    public final Map<String, Integer> productAndQuantity;
    public final boolean              accepted;

    OrderState(OrderId orderId, Map<String, Integer> productAndQuantity, boolean accepted) {
        this.orderId = orderId;
        this.productAndQuantity = Map.copyOf(productAndQuantity);
        this.accepted = accepted;
    }

    public boolean exists() {
        return orderId != null;
    }

    public List<OrderEvent> create(OrderId orderId, String customer, long orderNumber) {
        if (exists()) {
            throw new InvalidStateException("Order already exists");
        }
        if (orderNumber <= 0) {
            throw new ConstraintViolationException("orderNumber must be positive");
        }
        return List.of(new OrderEvent.OrderAdded(orderId, customer, orderNumber));
    }

    public List<OrderEvent> addProduct(String product, int quantity) {
        if (accepted) {
            throw new InvalidStateException("Cannot add products to an accepted order");
        }
        if (productAndQuantity.size() >= 3 && !productAndQuantity.containsKey(product)) {
            throw new LimitExceededException("products_per_order", 3);
        }
        return List.of(new OrderEvent.ProductAddedToOrder(orderId, product, quantity));
    }

    public List<OrderEvent> accept() {
        if (accepted) {
            return List.of();
        }
        return List.of(new OrderEvent.OrderAccepted(orderId));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderState)) return false;
        var that = (OrderState) o;
        return accepted == that.accepted && Objects.equals(orderId, that.orderId) && productAndQuantity.equals(that.productAndQuantity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, productAndQuantity, accepted);
    }
}
