package dk.cloudcreate.imkitchen.mealplanning.recipe;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.math.BigDecimal;
import java.util.Objects;

public final class Ingredient {
    public final String     name;
    public final BigDecimal quantity;
    public final String     unit;

    @JsonCreator
    public Ingredient(String name, BigDecimal quantity, String unit) {
        this.name = name;
        this.quantity = quantity;
        this.unit = unit;
    }

    public static Ingredient of(String name, String quantity, String unit) {
        return new Ingredient(name, new BigDecimal(quantity), unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Ingredient)) return false;
        var that = (Ingredient) o;
        return Objects.equals(name, that.name) &&
                (quantity == null ? that.quantity == null : that.quantity != null && quantity.compareTo(that.quantity) == 0) &&
                Objects.equals(unit, that.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, unit);
    }

    @Override
    public String toString() {
        return quantity + " " + unit + " " + name;
    }
}
