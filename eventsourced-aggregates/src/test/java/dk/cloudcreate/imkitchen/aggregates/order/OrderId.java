package dk.cloudcreate.imkitchen.aggregates.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

@JsonSerialize(using = ToStringSerializer.class)
public class OrderId extends CharSequenceType<OrderId> {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public OrderId(String value) {
        super(value);
    }

    public static OrderId random() {
        return new OrderId(UUID.randomUUID().toString());
    }
}
