package dk.cloudcreate.imkitchen.mealplanning.readmodel;

import dk.cloudcreate.imkitchen.common.transaction.HandleAwareUnitOfWork;
import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.types.UserId;
import dk.cloudcreate.imkitchen.projections.*;
import org.jdbi.v3.core.Handle;

import java.util.Set;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Maintains the per user dashboard metrics from both the recipe and the meal plan streams, so it has a cursor per stream.<br>
 * Recipe flags are kept in <code>dashboard_recipe_flags</code> and the counters in <code>dashboard_metrics</code> are recomputed
 * from them after every recipe event.
 */
public class DashboardProjection implements ProjectionHandler {
    public static final String NAME                   = "dashboard_projection";
    public static final String DASHBOARD_RECIPE_FLAGS = "dashboard_recipe_flags";
    public static final String DASHBOARD_METRICS      = "dashboard_metrics";

    private final RecipeEvents   recipeEvents   = new RecipeEvents();
    private final MealPlanEvents mealPlanEvents = new MealPlanEvents();

    @Override
    public String projectionName() {
        return NAME;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(Recipe.RECIPES, MealPlan.MEAL_PLANS);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("RecipeCreated"),
                      EventType.of("RecipeFavorited"),
                      EventType.of("RecipeDeleted"),
                      EventType.of("MealPlanGenerated"),
                      EventType.of("MealPlanArchived"));
    }

    @Override
    public void apply(HandleAwareUnitOfWork unitOfWork, PersistedEvent event) {
        var handle = unitOfWork.handle();
        if (event.aggregateType().equals(Recipe.RECIPES)) {
            deserialize(event, RecipeEvent.class).accept(recipeEvents, handle);
        } else if (event.aggregateType().equals(MealPlan.MEAL_PLANS)) {
            deserialize(event, MealPlanEvent.class).accept(mealPlanEvents, handle);
        } else {
            throw new ProjectionException(msg("[{}] Unsupported aggregate type '{}'", NAME, event.aggregateType()));
        }
    }

    private static <T> T deserialize(PersistedEvent event, Class<T> eventType) {
        return event.event()
                    .deserializeAs(eventType)
                    .orElseThrow(() -> new ProjectionException(msg("[{}] Event '{}' with global order {} isn't a {}",
                                                                   NAME,
                                                                   event.eventType(),
                                                                   event.globalEventOrder(),
                                                                   eventType.getName())));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + DASHBOARD_RECIPE_FLAGS + " (\n" +
                               "    recipe_id text PRIMARY KEY,\n" +
                               "    user_id   text NOT NULL,\n" +
                               "    favorited boolean NOT NULL,\n" +
                               "    deleted   boolean NOT NULL\n" +
                               ")");
        handle.execute("CREATE INDEX IF NOT EXISTS idx_" + DASHBOARD_RECIPE_FLAGS + "_user ON " + DASHBOARD_RECIPE_FLAGS + " (user_id)");
        handle.execute("CREATE TABLE IF NOT EXISTS " + DASHBOARD_METRICS + " (\n" +
                               "    user_id                text PRIMARY KEY,\n" +
                               "    recipe_count           integer NOT NULL DEFAULT 0,\n" +
                               "    favorite_count         integer NOT NULL DEFAULT 0,\n" +
                               "    active_meal_plan_id    text,\n" +
                               "    last_plan_generated_at timestamptz\n" +
                               ")");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + DASHBOARD_RECIPE_FLAGS + ", " + DASHBOARD_METRICS);
    }

    private static void recomputeRecipeCounts(Handle handle, UserId userId) {
        handle.createUpdate("INSERT INTO " + DASHBOARD_METRICS + " (user_id, recipe_count, favorite_count)\n" +
                                    "SELECT :userId,\n" +
                                    "       count(*) FILTER (WHERE NOT deleted),\n" +
                                    "       count(*) FILTER (WHERE favorited AND NOT deleted)\n" +
                                    "FROM " + DASHBOARD_RECIPE_FLAGS + " WHERE user_id = :userId\n" +
                                    "ON CONFLICT (user_id) DO UPDATE SET recipe_count = EXCLUDED.recipe_count, favorite_count = EXCLUDED.favorite_count")
              .bind("userId", userId.toString())
              .execute();
    }

    private static final class RecipeEvents implements RecipeEventVisitor<Handle, Void> {
        @Override
        public Void on(RecipeEvent.RecipeCreated event, Handle handle) {
            handle.createUpdate("INSERT INTO " + DASHBOARD_RECIPE_FLAGS + " (recipe_id, user_id, favorited, deleted)\n" +
                                        "VALUES (:recipeId, :userId, false, false)\n" +
                                        "ON CONFLICT (recipe_id) DO UPDATE SET user_id = EXCLUDED.user_id, favorited = false, deleted = false")
                  .bind("recipeId", event.recipeId.toString())
                  .bind("userId", event.ownerId.toString())
                  .execute();
            recomputeRecipeCounts(handle, event.ownerId);
            return null;
        }

        @Override
        public Void on(RecipeEvent.RecipeUpdated event, Handle handle) {
            return null;
        }

        @Override
        public Void on(RecipeEvent.RecipeFavorited event, Handle handle) {
            handle.createUpdate("UPDATE " + DASHBOARD_RECIPE_FLAGS + " SET favorited = :favorited WHERE recipe_id = :recipeId")
                  .bind("recipeId", event.recipeId.toString())
                  .bind("favorited", event.favorited)
                  .execute();
            recomputeRecipeCounts(handle, event.ownerId);
            return null;
        }

        @Override
        public Void on(RecipeEvent.RecipeShared event, Handle handle) {
            return null;
        }

        @Override
        public Void on(RecipeEvent.RecipeDeleted event, Handle handle) {
            handle.createUpdate("UPDATE " + DASHBOARD_RECIPE_FLAGS + " SET deleted = true WHERE recipe_id = :recipeId")
                  .bind("recipeId", event.recipeId.toString())
                  .execute();
            recomputeRecipeCounts(handle, event.ownerId);
            return null;
        }
    }

    private static final class MealPlanEvents implements MealPlanEventVisitor<Handle, Void> {
        @Override
        public Void on(MealPlanEvent.MealPlanGenerated event, Handle handle) {
            handle.createUpdate("INSERT INTO " + DASHBOARD_METRICS + " (user_id, active_meal_plan_id, last_plan_generated_at)\n" +
                                        "VALUES (:userId, :mealPlanId, :generatedAt)\n" +
                                        "ON CONFLICT (user_id) DO UPDATE SET active_meal_plan_id = EXCLUDED.active_meal_plan_id,\n" +
                                        "    last_plan_generated_at = EXCLUDED.last_plan_generated_at")
                  .bind("userId", event.userId.toString())
                  .bind("mealPlanId", event.mealPlanId.toString())
                  .bind("generatedAt", event.generatedAt)
                  .execute();
            return null;
        }

        @Override
        public Void on(MealPlanEvent.MealReplaced event, Handle handle) {
            return null;
        }

        @Override
        public Void on(MealPlanEvent.MealPlanArchived event, Handle handle) {
            handle.createUpdate("UPDATE " + DASHBOARD_METRICS + " SET active_meal_plan_id = NULL\n" +
                                        "WHERE user_id = :userId AND active_meal_plan_id = :mealPlanId")
                  .bind("userId", event.userId.toString())
                  .bind("mealPlanId", event.mealPlanId.toString())
                  .execute();
            return null;
        }
    }
}
