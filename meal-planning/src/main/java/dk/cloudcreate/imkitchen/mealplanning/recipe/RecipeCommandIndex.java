package dk.cloudcreate.imkitchen.mealplanning.recipe;

import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.jdbi.v3.core.Handle;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.bind;

/**
 * Command side index of the recipes, written by the recipe command handlers in the same transaction as the recipe events.<br>
 * Answers the questions commands need across recipes (how many recipes does a user own, which recipes are a user's favorites)
 * without depending on the eventually consistent read models.
 */
public final class RecipeCommandIndex {
    public static final String TABLE_NAME = "recipe_command_index";

    private RecipeCommandIndex() {
    }

    public static void createTable(Handle handle) {
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:table} (\n" +
                                    "    recipe_id          text PRIMARY KEY,\n" +
                                    "    owner_id           text NOT NULL,\n" +
                                    "    recipe_type        text NOT NULL,\n" +
                                    "    advance_prep_hours integer NOT NULL,\n" +
                                    "    favorited          boolean NOT NULL,\n" +
                                    "    deleted            boolean NOT NULL\n" +
                                    ")",
                            arg("table", TABLE_NAME)));
        handle.execute(bind("CREATE INDEX IF NOT EXISTS idx_{:table}_owner ON {:table} (owner_id)", arg("table", TABLE_NAME)));
    }

    /**
     * Serializes the commands that count or select a user's recipes until the current transaction ends
     */
    public static void lockOwner(Handle handle, UserId ownerId) {
        requireNonNull(ownerId, "No ownerId provided");
        handle.createQuery("SELECT count(*) FROM (SELECT pg_advisory_xact_lock(hashtext(:lockName))) AS l")
              .bind("lockName", TABLE_NAME + ":" + ownerId)
              .mapTo(Long.class)
              .one();
    }

    public static int countActiveRecipes(Handle handle, UserId ownerId) {
        return handle.createQuery(bind("SELECT count(*) FROM {:table} WHERE owner_id = :ownerId AND NOT deleted", arg("table", TABLE_NAME)))
                     .bind("ownerId", ownerId.toString())
                     .mapTo(Integer.class)
                     .one();
    }

    public static void insert(Handle handle, RecipeId recipeId, UserId ownerId, CourseType recipeType, int advancePrepHours) {
        handle.createUpdate(bind("INSERT INTO {:table} (recipe_id, owner_id, recipe_type, advance_prep_hours, favorited, deleted)\n" +
                                         "VALUES (:recipeId, :ownerId, :recipeType, :advancePrepHours, false, false)",
                                 arg("table", TABLE_NAME)))
              .bind("recipeId", recipeId.toString())
              .bind("ownerId", ownerId.toString())
              .bind("recipeType", recipeType.name())
              .bind("advancePrepHours", advancePrepHours)
              .execute();
    }

    public static void updateAdvancePrepHours(Handle handle, RecipeId recipeId, int advancePrepHours) {
        handle.createUpdate(bind("UPDATE {:table} SET advance_prep_hours = :advancePrepHours WHERE recipe_id = :recipeId", arg("table", TABLE_NAME)))
              .bind("recipeId", recipeId.toString())
              .bind("advancePrepHours", advancePrepHours)
              .execute();
    }

    public static void setFavorited(Handle handle, RecipeId recipeId, boolean favorited) {
        handle.createUpdate(bind("UPDATE {:table} SET favorited = :favorited WHERE recipe_id = :recipeId", arg("table", TABLE_NAME)))
              .bind("recipeId", recipeId.toString())
              .bind("favorited", favorited)
              .execute();
    }

    public static void markDeleted(Handle handle, RecipeId recipeId) {
        handle.createUpdate(bind("UPDATE {:table} SET deleted = true WHERE recipe_id = :recipeId", arg("table", TABLE_NAME)))
              .bind("recipeId", recipeId.toString())
              .execute();
    }

    /**
     * @return the user's favorite, non deleted, recipes ordered by recipe id
     */
    public static List<IndexedRecipe> favoritesOf(Handle handle, UserId ownerId) {
        return handle.createQuery(bind("SELECT * FROM {:table} WHERE owner_id = :ownerId AND favorited AND NOT deleted ORDER BY recipe_id",
                                       arg("table", TABLE_NAME)))
                     .bind("ownerId", ownerId.toString())
                     .map((rs, ctx) -> new IndexedRecipe(RecipeId.of(rs.getString("recipe_id")),
                                                         UserId.of(rs.getString("owner_id")),
                                                         CourseType.valueOf(rs.getString("recipe_type")),
                                                         rs.getInt("advance_prep_hours"),
                                                         rs.getBoolean("favorited"),
                                                         rs.getBoolean("deleted")))
                     .list();
    }

    public static final class IndexedRecipe {
        public final RecipeId   recipeId;
        public final UserId     ownerId;
        public final CourseType recipeType;
        public final int        advancePrepHours;
        public final boolean    favorited;
        public final boolean    deleted;

        public IndexedRecipe(RecipeId recipeId, UserId ownerId, CourseType recipeType, int advancePrepHours, boolean favorited, boolean deleted) {
            this.recipeId = recipeId;
            this.ownerId = ownerId;
            this.recipeType = recipeType;
            this.advancePrepHours = advancePrepHours;
            this.favorited = favorited;
            this.deleted = deleted;
        }

        @Override
        public String toString() {
            return "IndexedRecipe{" +
                    "recipeId=" + recipeId +
                    ", recipeType=" + recipeType +
                    ", favorited=" + favorited +
                    ", deleted=" + deleted +
                    '}';
        }
    }
}
