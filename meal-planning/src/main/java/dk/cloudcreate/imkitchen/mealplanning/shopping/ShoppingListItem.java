package dk.cloudcreate.imkitchen.mealplanning.shopping;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.math.BigDecimal;
import java.util.Objects;

public final class ShoppingListItem {
    public final String             ingredientName;
    public final BigDecimal         quantity;
    public final String             unit;
    public final IngredientCategory category;

    @JsonCreator
    public ShoppingListItem(String ingredientName, BigDecimal quantity, String unit, IngredientCategory category) {
        this.ingredientName = ingredientName;
        this.quantity = quantity;
        this.unit = unit;
        this.category = category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShoppingListItem)) return false;
        var that = (ShoppingListItem) o;
        return Objects.equals(ingredientName, that.ingredientName) &&
                (quantity == null ? that.quantity == null : that.quantity != null && quantity.compareTo(that.quantity) == 0) &&
                Objects.equals(unit, that.unit) &&
                category == that.category;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ingredientName, unit, category);
    }

    @Override
    public String toString() {
        return quantity + " " + unit + " " + ingredientName + " (" + category + ")";
    }
}
