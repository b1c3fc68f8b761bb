package dk.cloudcreate.imkitchen.mealplanning.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

@JsonSerialize(using = ToStringSerializer.class)
public class UserId extends CharSequenceType<UserId> {
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public UserId(String value) {
        super(value);
    }

    public static UserId of(CharSequence value) {
        return new UserId(value.toString());
    }

    public static UserId random() {
        return new UserId(UUID.randomUUID().toString());
    }
}
