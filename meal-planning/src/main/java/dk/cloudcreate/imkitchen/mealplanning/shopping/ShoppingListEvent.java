package dk.cloudcreate.imkitchen.mealplanning.shopping;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.*;
import java.util.List;

/**
 * Events of the {@link ShoppingList} aggregate
 */
public abstract class ShoppingListEvent {
    public final ShoppingListId shoppingListId;
    public final UserId         userId;

    protected ShoppingListEvent(ShoppingListId shoppingListId, UserId userId) {
        this.shoppingListId = shoppingListId;
        this.userId = userId;
    }

    public abstract <C, R> R accept(ShoppingListEventVisitor<C, R> visitor, C context);

    public static final class ShoppingListGenerated extends ShoppingListEvent {
        public final MealPlanId             mealPlanId;
        public final LocalDate              weekStartDate;
        public final List<ShoppingListItem> items;
        public final Instant                generatedAt;

        @JsonCreator
        public ShoppingListGenerated(ShoppingListId shoppingListId,
                                     UserId userId,
                                     MealPlanId mealPlanId,
                                     LocalDate weekStartDate,
                                     List<ShoppingListItem> items,
                                     Instant generatedAt) {
            super(shoppingListId, userId);
            this.mealPlanId = mealPlanId;
            this.weekStartDate = weekStartDate;
            this.items = items;
            this.generatedAt = generatedAt;
        }

        @Override
        public <C, R> R accept(ShoppingListEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class ShoppingListItemCollected extends ShoppingListEvent {
        /**
         * 0 based index into {@link ShoppingListGenerated#items}
         */
        public final int     itemIndex;
        public final boolean collected;
        public final Instant collectedAt;

        @JsonCreator
        public ShoppingListItemCollected(ShoppingListId shoppingListId, UserId userId, int itemIndex, boolean collected, Instant collectedAt) {
            super(shoppingListId, userId);
            this.itemIndex = itemIndex;
            this.collected = collected;
            this.collectedAt = collectedAt;
        }

        @Override
        public <C, R> R accept(ShoppingListEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }
}
