package dk.cloudcreate.imkitchen.mealplanning.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

@JsonSerialize(using = ToStringSerializer.class)
public class RecipeId extends CharSequenceType<RecipeId> {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RecipeId(String value) {
        super(value);
    }

    public static RecipeId of(CharSequence value) {
        return new RecipeId(value.toString());
    }

    public static RecipeId random() {
        return new RecipeId(UUID.randomUUID().toString());
    }
}
