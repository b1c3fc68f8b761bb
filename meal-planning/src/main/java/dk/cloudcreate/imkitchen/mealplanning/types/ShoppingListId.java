package dk.cloudcreate.imkitchen.mealplanning.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

@JsonSerialize(using = ToStringSerializer.class)
public class ShoppingListId extends CharSequenceType<ShoppingListId> {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public ShoppingListId(String value) {
        super(value);
    }

    public static ShoppingListId of(CharSequence value) {
        return new ShoppingListId(value.toString());
    }

    public static ShoppingListId random() {
        return new ShoppingListId(UUID.randomUUID().toString());
    }
}
