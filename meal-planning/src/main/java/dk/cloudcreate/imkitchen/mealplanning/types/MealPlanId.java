package dk.cloudcreate.imkitchen.mealplanning.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

@JsonSerialize(using = ToStringSerializer.class)
public class MealPlanId extends CharSequenceType<MealPlanId> {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public MealPlanId(String value) {
        super(value);
    }

    public static MealPlanId of(CharSequence value) {
        return new MealPlanId(value.toString());
    }

    public static MealPlanId random() {
        return new MealPlanId(UUID.randomUUID().toString());
    }
}
