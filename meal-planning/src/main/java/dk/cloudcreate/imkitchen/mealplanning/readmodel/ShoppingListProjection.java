package dk.cloudcreate.imkitchen.mealplanning.readmodel;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.mealplanning.shopping.*;
import dk.cloudcreate.imkitchen.mealplanning.types.ShoppingListId;
import dk.cloudcreate.imkitchen.projections.TypedProjectionHandler;
import org.jdbi.v3.core.Handle;

import java.time.Instant;
import java.util.Set;

/**
 * Maintains <code>shopping_list_view</code> (one row per item) and <code>shopping_list_summary</code> (one row per list)
 */
public class ShoppingListProjection extends TypedProjectionHandler<ShoppingListEvent> implements ShoppingListEventVisitor<Handle, Void> {
    public static final String NAME                  = "shopping_list_projection";
    public static final String SHOPPING_LIST_VIEW    = "shopping_list_view";
    public static final String SHOPPING_LIST_SUMMARY = "shopping_list_summary";

    public ShoppingListProjection() {
        super(ShoppingListEvent.class);
    }

    public static String itemId(ShoppingListId shoppingListId, int itemIndex) {
        return shoppingListId + ":" + itemIndex;
    }

    @Override
    public String projectionName() {
        return NAME;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(ShoppingList.SHOPPING_LISTS);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("ShoppingListGenerated"),
                      EventType.of("ShoppingListItemCollected"));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + SHOPPING_LIST_VIEW + " (\n" +
                               "    id               text PRIMARY KEY,\n" +
                               "    shopping_list_id text NOT NULL,\n" +
                               "    user_id          text NOT NULL,\n" +
                               "    meal_plan_id     text NOT NULL,\n" +
                               "    week_start_date  date NOT NULL,\n" +
                               "    item_index       integer NOT NULL,\n" +
                               "    ingredient_name  text NOT NULL,\n" +
                               "    quantity         numeric NOT NULL,\n" +
                               "    unit             text,\n" +
                               "    category         text NOT NULL,\n" +
                               "    is_collected     boolean NOT NULL,\n" +
                               "    collected_at     timestamptz\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS idx_" + SHOPPING_LIST_VIEW + "_list ON " + SHOPPING_LIST_VIEW + " (shopping_list_id)");
        handle.execute("CREATE TABLE IF NOT EXISTS " + SHOPPING_LIST_SUMMARY + " (\n" +
                               "    shopping_list_id text PRIMARY KEY,\n" +
                               "    user_id          text NOT NULL,\n" +
                               "    week_start_date  date NOT NULL,\n" +
                               "    total_items      integer NOT NULL,\n" +
                               "    collected_items  integer NOT NULL,\n" +
                               "    generated_at     timestamptz NOT NULL\n" +
                               ")");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + SHOPPING_LIST_VIEW + ", " + SHOPPING_LIST_SUMMARY);
    }

    @Override
    protected void handle(Handle handle, PersistedEvent persistedEvent, ShoppingListEvent event) {
        event.accept(this, handle);
    }

    @Override
    public Void on(ShoppingListEvent.ShoppingListGenerated event, Handle handle) {
        var batch = handle.prepareBatch("INSERT INTO " + SHOPPING_LIST_VIEW + " (id, shopping_list_id, user_id, meal_plan_id, week_start_date,\n" +
                                                "    item_index, ingredient_name, quantity, unit, category, is_collected, collected_at)\n" +
                                                "VALUES (:id, :shoppingListId, :userId, :mealPlanId, :weekStartDate,\n" +
                                                "    :itemIndex, :ingredientName, :quantity, :unit, :category, false, NULL)\n" +
                                                "ON CONFLICT (id) DO UPDATE SET ingredient_name = EXCLUDED.ingredient_name, quantity = EXCLUDED.quantity,\n" +
                                                "    unit = EXCLUDED.unit, category = EXCLUDED.category, is_collected = false, collected_at = NULL");
        for (var itemIndex = 0; itemIndex < event.items.size(); itemIndex++) {
            var item = event.items.get(itemIndex);
            batch.bind("id", itemId(event.shoppingListId, itemIndex))
                 .bind("shoppingListId", event.shoppingListId.toString())
                 .bind("userId", event.userId.toString())
                 .bind("mealPlanId", event.mealPlanId.toString())
                 .bind("weekStartDate", event.weekStartDate)
                 .bind("itemIndex", itemIndex)
                 .bind("ingredientName", item.ingredientName)
                 .bind("quantity", item.quantity)
                 .bind("unit", item.unit)
                 .bind("category", item.category.name())
                 .add();
        }
        if (batch.size() > 0) {
            batch.execute();
        }
        handle.createUpdate("INSERT INTO " + SHOPPING_LIST_SUMMARY + " (shopping_list_id, user_id, week_start_date, total_items, collected_items, generated_at)\n" +
                                    "VALUES (:shoppingListId, :userId, :weekStartDate, :totalItems, 0, :generatedAt)\n" +
                                    "ON CONFLICT (shopping_list_id) DO UPDATE SET total_items = EXCLUDED.total_items, collected_items = 0,\n" +
                                    "    generated_at = EXCLUDED.generated_at")
              .bind("shoppingListId", event.shoppingListId.toString())
              .bind("userId", event.userId.toString())
              .bind("weekStartDate", event.weekStartDate)
              .bind("totalItems", event.items.size())
              .bind("generatedAt", event.generatedAt)
              .execute();
        return null;
    }

    @Override
    public Void on(ShoppingListEvent.ShoppingListItemCollected event, Handle handle) {
        handle.createUpdate("UPDATE " + SHOPPING_LIST_VIEW + " SET is_collected = :collected, collected_at = :collectedAt WHERE id = :id")
              .bind("id", itemId(event.shoppingListId, event.itemIndex))
              .bind("collected", event.collected)
              .bindByType("collectedAt", event.collected ? event.collectedAt : null, Instant.class)
              .execute();
        handle.createUpdate("UPDATE " + SHOPPING_LIST_SUMMARY + " SET collected_items =\n" +
                                    "    (SELECT count(*) FROM " + SHOPPING_LIST_VIEW + " WHERE shopping_list_id = :shoppingListId AND is_collected)\n" +
                                    "WHERE shopping_list_id = :shoppingListId")
              .bind("shoppingListId", event.shoppingListId.toString())
              .execute();
        return null;
    }
}
