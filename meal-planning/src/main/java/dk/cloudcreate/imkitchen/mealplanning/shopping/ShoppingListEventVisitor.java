package dk.cloudcreate.imkitchen.mealplanning.shopping;

public interface ShoppingListEventVisitor<C, R> {
    R on(ShoppingListEvent.ShoppingListGenerated event, C context);

    R on(ShoppingListEvent.ShoppingListItemCollected event, C context);
}
