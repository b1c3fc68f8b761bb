package dk.cloudcreate.imkitchen.mealplanning.readmodel;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.types.RecipeId;
import dk.cloudcreate.imkitchen.projections.TypedProjectionHandler;
import org.jdbi.v3.core.Handle;

import java.time.Instant;
import java.util.*;

/**
 * Maintains the recipe library read model: one <code>recipe_list</code> row per recipe and its ingredients in
 * <code>recipe_ingredients</code>. Deleted recipes keep their row with <code>deleted_at</code> set
 */
public class RecipeListProjection extends TypedProjectionHandler<RecipeEvent> implements RecipeEventVisitor<Handle, Void> {
    public static final String NAME               = "recipe_list_projection";
    public static final String RECIPE_LIST        = "recipe_list";
    public static final String RECIPE_INGREDIENTS = "recipe_ingredients";

    public RecipeListProjection() {
        super(RecipeEvent.class);
    }

    @Override
    public String projectionName() {
        return NAME;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(Recipe.RECIPES);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("RecipeCreated"),
                      EventType.of("RecipeUpdated"),
                      EventType.of("RecipeFavorited"),
                      EventType.of("RecipeShared"),
                      EventType.of("RecipeDeleted"));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + RECIPE_LIST + " (\n" +
                               "    id                 text PRIMARY KEY,\n" +
                               "    user_id            text NOT NULL,\n" +
                               "    title              text NOT NULL,\n" +
                               "    recipe_type        text NOT NULL,\n" +
                               "    prep_time_min      integer NOT NULL,\n" +
                               "    cook_time_min      integer NOT NULL,\n" +
                               "    advance_prep_hours integer NOT NULL,\n" +
                               "    serving_size       integer NOT NULL,\n" +
                               "    ingredient_count   integer NOT NULL,\n" +
                               "    is_favorite        boolean NOT NULL,\n" +
                               "    is_shared          boolean NOT NULL,\n" +
                               "    created_at         timestamptz NOT NULL,\n" +
                               "    updated_at         timestamptz NOT NULL,\n" +
                               "    deleted_at         timestamptz\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS idx_" + RECIPE_LIST + "_user ON " + RECIPE_LIST + " (user_id)");
        handle.execute("CREATE TABLE IF NOT EXISTS " + RECIPE_INGREDIENTS + " (\n" +
                               "    recipe_id text NOT NULL,\n" +
                               "    position  integer NOT NULL,\n" +
                               "    name      text NOT NULL,\n" +
                               "    quantity  numeric NOT NULL,\n" +
                               "    unit      text,\n" +
                               "    PRIMARY KEY (recipe_id, position)\n" +
                               ")");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + RECIPE_LIST + ", " + RECIPE_INGREDIENTS);
    }

    @Override
    protected void handle(Handle handle, PersistedEvent persistedEvent, RecipeEvent event) {
        event.accept(this, handle);
    }

    @Override
    public Void on(RecipeEvent.RecipeCreated event, Handle handle) {
        handle.createUpdate("INSERT INTO " + RECIPE_LIST + " (id, user_id, title, recipe_type, prep_time_min, cook_time_min, advance_prep_hours,\n" +
                                    "    serving_size, ingredient_count, is_favorite, is_shared, created_at, updated_at, deleted_at)\n" +
                                    "VALUES (:id, :userId, :title, :recipeType, :prepTimeMin, :cookTimeMin, :advancePrepHours,\n" +
                                    "    :servingSize, :ingredientCount, false, false, :createdAt, :createdAt, NULL)\n" +
                                    "ON CONFLICT (id) DO UPDATE SET user_id = EXCLUDED.user_id, title = EXCLUDED.title, recipe_type = EXCLUDED.recipe_type,\n" +
                                    "    prep_time_min = EXCLUDED.prep_time_min, cook_time_min = EXCLUDED.cook_time_min,\n" +
                                    "    advance_prep_hours = EXCLUDED.advance_prep_hours, serving_size = EXCLUDED.serving_size,\n" +
                                    "    ingredient_count = EXCLUDED.ingredient_count, is_favorite = false, is_shared = false,\n" +
                                    "    created_at = EXCLUDED.created_at, updated_at = EXCLUDED.updated_at, deleted_at = NULL")
              .bind("id", event.recipeId.toString())
              .bind("userId", event.ownerId.toString())
              .bind("title", event.title)
              .bind("recipeType", event.recipeType.name())
              .bind("prepTimeMin", event.prepTimeMin)
              .bind("cookTimeMin", event.cookTimeMin)
              .bind("advancePrepHours", event.advancePrepHours)
              .bind("servingSize", event.servingSize)
              .bind("ingredientCount", event.ingredients.size())
              .bind("createdAt", event.createdAt)
              .execute();
        replaceIngredients(handle, event.recipeId, event.ingredients);
        return null;
    }

    @Override
    public Void on(RecipeEvent.RecipeUpdated event, Handle handle) {
        handle.createUpdate("UPDATE " + RECIPE_LIST + " SET title = :title, prep_time_min = :prepTimeMin, cook_time_min = :cookTimeMin,\n" +
                                    "    advance_prep_hours = :advancePrepHours, serving_size = :servingSize, ingredient_count = :ingredientCount,\n" +
                                    "    updated_at = :updatedAt\n" +
                                    "WHERE id = :id")
              .bind("id", event.recipeId.toString())
              .bind("title", event.title)
              .bind("prepTimeMin", event.prepTimeMin)
              .bind("cookTimeMin", event.cookTimeMin)
              .bind("advancePrepHours", event.advancePrepHours)
              .bind("servingSize", event.servingSize)
              .bind("ingredientCount", event.ingredients.size())
              .bind("updatedAt", event.updatedAt)
              .execute();
        replaceIngredients(handle, event.recipeId, event.ingredients);
        return null;
    }

    @Override
    public Void on(RecipeEvent.RecipeFavorited event, Handle handle) {
        updateFlag(handle, event.recipeId, "is_favorite", event.favorited, event.toggledAt);
        return null;
    }

    @Override
    public Void on(RecipeEvent.RecipeShared event, Handle handle) {
        updateFlag(handle, event.recipeId, "is_shared", event.shared, event.sharedAt);
        return null;
    }

    @Override
    public Void on(RecipeEvent.RecipeDeleted event, Handle handle) {
        handle.createUpdate("UPDATE " + RECIPE_LIST + " SET deleted_at = :deletedAt, updated_at = :deletedAt WHERE id = :id")
              .bind("id", event.recipeId.toString())
              .bind("deletedAt", event.deletedAt)
              .execute();
        return null;
    }

    private static void updateFlag(Handle handle, RecipeId recipeId, String column, boolean value, Instant updatedAt) {
        handle.createUpdate("UPDATE " + RECIPE_LIST + " SET " + column + " = :value, updated_at = :updatedAt WHERE id = :id")
              .bind("id", recipeId.toString())
              .bind("value", value)
              .bind("updatedAt", updatedAt)
              .execute();
    }

    private static void replaceIngredients(Handle handle, RecipeId recipeId, List<Ingredient> ingredients) {
        handle.createUpdate("DELETE FROM " + RECIPE_INGREDIENTS + " WHERE recipe_id = :recipeId")
              .bind("recipeId", recipeId.toString())
              .execute();
        var batch = handle.prepareBatch("INSERT INTO " + RECIPE_INGREDIENTS + " (recipe_id, position, name, quantity, unit)\n" +
                                                "VALUES (:recipeId, :position, :name, :quantity, :unit)");
        for (var position = 0; position < ingredients.size(); position++) {
            var ingredient = ingredients.get(position);
            batch.bind("recipeId", recipeId.toString())
                 .bind("position", position)
                 .bind("name", ingredient.name)
                 .bind("quantity", ingredient.quantity)
                 .bind("unit", ingredient.unit)
                 .add();
        }
        if (batch.size() > 0) {
            batch.execute();
        }
    }
}
