package dk.cloudcreate.imkitchen.aggregates.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public abstract class OrderEvent {
    public static final AggregateType ORDERS = AggregateType.of("Orders");

    public final OrderId orderId;

    protected OrderEvent(OrderId orderId) {
        this.orderId = requireNonNull(orderId);
    }

    public static AggregateTypeConfiguration configuration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(ORDERS, jsonSerializer)
                                         .registerEventType("OrderAdded", OrderAdded.class)
                                         .registerEventType("ProductAddedToOrder", ProductAddedToOrder.class)
                                         .registerEventType("OrderAccepted", OrderAccepted.class);
    }

    public static class OrderAdded extends OrderEvent {
        public final String customer;
        public final long   orderNumber;

        @JsonCreator
        public OrderAdded(OrderId orderId, String customer, long orderNumber) {
            super(orderId);
            this.customer = customer;
            this.orderNumber = orderNumber;
        }
    }

    public static class ProductAddedToOrder extends OrderEvent {
        public final String product;
        public final int    quantity;

        @JsonCreator
        public ProductAddedToOrder(OrderId orderId, String product, int quantity) {
            super(orderId);
            this.product = product;
            this.quantity = quantity;
        }
    }

    public static class OrderAccepted extends OrderEvent {
        @JsonCreator
        public OrderAccepted(OrderId orderId) {
            super(orderId);
        }
    }
}
