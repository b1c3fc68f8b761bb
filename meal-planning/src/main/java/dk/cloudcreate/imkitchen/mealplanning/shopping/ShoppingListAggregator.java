package dk.cloudcreate.imkitchen.mealplanning.shopping;

import dk.cloudcreate.imkitchen.mealplanning.recipe.Ingredient;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Combines the ingredients of the meals of a week into shopping list items.<br>
 * Ingredients with the same name and unit (compared case and whitespace insensitively) are summed. Ingredients with the same
 * name but different units stay separate items. Items are sorted by {@link IngredientCategory}, then name, then unit.
 */
public final class ShoppingListAggregator {
    private ShoppingListAggregator() {
    }

    public static List<ShoppingListItem> aggregate(List<Ingredient> ingredients) {
        requireNonNull(ingredients, "No ingredients provided");
        var quantities = new LinkedHashMap<List<String>, BigDecimal>();
        for (var ingredient : ingredients) {
            var name = IngredientCategory.normalize(ingredient.name);
            var unit = ingredient.unit == null ? "" : IngredientCategory.normalize(ingredient.unit);
            quantities.merge(List.of(name, unit), ingredient.quantity, BigDecimal::add);
        }
        return quantities.entrySet()
                         .stream()
                         .map(entry -> new ShoppingListItem(entry.getKey().get(0),
                                                            entry.getValue(),
                                                            entry.getKey().get(1),
                                                            IngredientCategory.categorize(entry.getKey().get(0))))
                         .sorted(Comparator.comparing((ShoppingListItem item) -> item.category)
                                           .thenComparing(item -> item.ingredientName)
                                           .thenComparing(item -> item.unit))
                         .collect(Collectors.toList());
    }
}
