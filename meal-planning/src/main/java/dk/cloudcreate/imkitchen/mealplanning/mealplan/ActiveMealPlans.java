package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.jdbi.v3.core.Handle;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.bind;

/**
 * Command side table that tracks the single active meal plan of each user
 */
public final class ActiveMealPlans {
    public static final String TABLE_NAME = "active_meal_plan";

    private ActiveMealPlans() {
    }

    public static void createTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:table} (\n" +
                                    "    user_id      text PRIMARY KEY,\n" +
                                    "    meal_plan_id text NOT NULL\n" +
                                    ")",
                            arg("table", TABLE_NAME)));
    }

    /**
     * Serializes the commands that change the active meal plan of the user until the current transaction ends
     */
    public static void lockUser(Handle handle, UserId userId) {
        requireNonNull(userId, "No userId provided");
        handle.createQuery("SELECT count(*) FROM (SELECT pg_advisory_xact_lock(hashtext(:lockName))) AS l")
              .bind("lockName", TABLE_NAME + ":" + userId)
              .mapTo(Long.class)
              .one();
    }

    public static Optional<MealPlanId> find(Handle handle, UserId userId) {
        return handle.createQuery(bind("SELECT meal_plan_id FROM {:table} WHERE user_id = :userId", arg("table", TABLE_NAME)))
                     .bind("userId", userId.toString())
                     .mapTo(String.class)
                     .findOne()
                     .map(MealPlanId::of);
    }

    public static void activate(Handle handle, UserId userId, MealPlanId mealPlanId) {
        handle.createUpdate(bind("INSERT INTO {:table} (user_id, meal_plan_id) VALUES (:userId, :mealPlanId)\n" +
                                         "ON CONFLICT (user_id) DO UPDATE SET meal_plan_id = EXCLUDED.meal_plan_id",
                                 arg("table", TABLE_NAME)))
              .bind("userId", userId.toString())
              .bind("mealPlanId", mealPlanId.toString())
              .execute();
    }

    /**
     * Clears the user's active meal plan if it's <code>mealPlanId</code>
     */
    public static void deactivate(Handle handle, UserId userId, MealPlanId mealPlanId) {
        handle.createUpdate(bind("DELETE FROM {:table} WHERE user_id = :userId AND meal_plan_id = :mealPlanId", arg("table", TABLE_NAME)))
              .bind("userId", userId.toString())
              .bind("mealPlanId", mealPlanId.toString())
              .execute();
    }
}
