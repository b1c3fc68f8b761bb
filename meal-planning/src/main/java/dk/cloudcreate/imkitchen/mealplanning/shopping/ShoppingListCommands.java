package dk.cloudcreate.imkitchen.mealplanning.shopping;

import dk.cloudcreate.imkitchen.aggregates.command.IdempotentCommand;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class ShoppingListCommands {
    private ShoppingListCommands() {
    }

    /**
     * Generate the shopping list of one week of an active meal plan
     */
    public static final class GenerateShoppingList {
        public final ShoppingListId shoppingListId;
        public final MealPlanId     mealPlanId;
        /**
         * 1 based
         */
        public final int            weekNumber;

        public GenerateShoppingList(ShoppingListId shoppingListId, MealPlanId mealPlanId, int weekNumber) {
            this.shoppingListId = requireNonNull(shoppingListId, "No shoppingListId provided");
            this.mealPlanId = requireNonNull(mealPlanId, "No mealPlanId provided");
            this.weekNumber = weekNumber;
        }

        public GenerateShoppingList(MealPlanId mealPlanId, int weekNumber) {
            this(ShoppingListId.random(), mealPlanId, weekNumber);
        }

        @Override
        public String toString() {
            return "GenerateShoppingList{shoppingListId=" + shoppingListId + ", mealPlanId=" + mealPlanId + ", weekNumber=" + weekNumber + "}";
        }
    }

    public static final class CollectShoppingListItem implements IdempotentCommand {
        public final ShoppingListId shoppingListId;
        public final int            itemIndex;
        public final boolean        collected;

        public CollectShoppingListItem(ShoppingListId shoppingListId, int itemIndex, boolean collected) {
            this.shoppingListId = requireNonNull(shoppingListId, "No shoppingListId provided");
            this.itemIndex = itemIndex;
            this.collected = collected;
        }

        @Override
        public String toString() {
            return "CollectShoppingListItem{shoppingListId=" + shoppingListId + ", itemIndex=" + itemIndex + ", collected=" + collected + "}";
        }
    }
}
