package dk.cloudcreate.imkitchen.mealplanning.shopping;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public final class ShoppingListState {
    public static final ShoppingListState NOT_GENERATED = new ShoppingListState(null, null, null, null, List.of(), Set.of());

    public final ShoppingListId         shoppingListId;
    public final UserId                 userId;
    public final MealPlanId             mealPlanId;
    public final LocalDate              weekStartDate;
    public final List<ShoppingListItem> items;
    public final Set<Integer>           collectedItems;

    ShoppingListState(ShoppingListId shoppingListId,
                      UserId userId,
                      MealPlanId mealPlanId,
                      LocalDate weekStartDate,
                      List<ShoppingListItem> items,
                      Set<Integer> collectedItems) {
        this.shoppingListId = shoppingListId;
        this.userId = userId;
        this.mealPlanId = mealPlanId;
        this.weekStartDate = weekStartDate;
        this.items = List.copyOf(items);
        this.collectedItems = Set.copyOf(collectedItems);
    }

    public boolean isGenerated() {
        return shoppingListId != null;
    }

    public List<ShoppingListEvent> generate(ShoppingListId shoppingListId,
                                            UserId userId,
                                            MealPlanId mealPlanId,
                                            LocalDate weekStartDate,
                                            List<ShoppingListItem> items,
                                            Instant now) {
        requireNonNull(shoppingListId, "No shoppingListId provided");
        requireNonNull(items, "No items provided");
        if (isGenerated()) {
            throw new InvalidStateException(msg("Shopping list '{}' has already been generated", shoppingListId));
        }
        return List.of(new ShoppingListEvent.ShoppingListGenerated(shoppingListId, userId, mealPlanId, weekStartDate, items, now));
    }

    public List<ShoppingListEvent> collect(int itemIndex, boolean collected, Instant now) {
        if (!isGenerated()) {
            throw new InvalidStateException("The shopping list hasn't been generated");
        }
        if (itemIndex < 0 || itemIndex >= items.size()) {
            throw new ConstraintViolationException(msg("Shopping list '{}' has no item with index {}", shoppingListId, itemIndex));
        }
        if (collectedItems.contains(itemIndex) == collected) {
            return List.of();
        }
        return List.of(new ShoppingListEvent.ShoppingListItemCollected(shoppingListId, userId, itemIndex, collected, now));
    }

    ShoppingListState withCollected(int itemIndex, boolean collected) {
        var updated = new HashSet<>(collectedItems);
        if (collected) {
            updated.add(itemIndex);
        } else {
            updated.remove(itemIndex);
        }
        return new ShoppingListState(shoppingListId, userId, mealPlanId, weekStartDate, items, updated);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShoppingListState)) return false;
        var that = (ShoppingListState) o;
        return Objects.equals(shoppingListId, that.shoppingListId) &&
                Objects.equals(userId, that.userId) &&
                Objects.equals(mealPlanId, that.mealPlanId) &&
                Objects.equals(weekStartDate, that.weekStartDate) &&
                Objects.equals(items, that.items) &&
                Objects.equals(collectedItems, that.collectedItems);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shoppingListId, userId, mealPlanId, weekStartDate, items, collectedItems);
    }

    @Override
    public String toString() {
        return "ShoppingListState{" +
                "shoppingListId=" + shoppingListId +
                ", mealPlanId=" + mealPlanId +
                ", weekStartDate=" + weekStartDate +
                ", items=" + items.size() +
                ", collectedItems=" + collectedItems.size() +
                '}';
    }
}
