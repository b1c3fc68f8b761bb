package dk.cloudcreate.imkitchen.mealplanning.recipe;

import dk.cloudcreate.imkitchen.aggregates.command.IdempotentCommand;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class RecipeCommands {
    private RecipeCommands() {
    }

    public static final class CreateRecipe {
        public final RecipeId              recipeId;
        public final UserId                ownerId;
        public final String                title;
        public final CourseType            recipeType;
        public final List<Ingredient>      ingredients;
        public final List<InstructionStep> instructions;
        public final int                   prepTimeMin;
        public final int                   cookTimeMin;
        public final int                   advancePrepHours;
        public final int                   servingSize;

        public CreateRecipe(RecipeId recipeId,
                            UserId ownerId,
                            String title,
                            CourseType recipeType,
                            List<Ingredient> ingredients,
                            List<InstructionStep> instructions,
                            int prepTimeMin,
                            int cookTimeMin,
                            int advancePrepHours,
                            int servingSize) {
            this.recipeId = requireNonNull(recipeId, "No recipeId provided");
            this.ownerId = requireNonNull(ownerId, "No ownerId provided");
            this.title = title;
            this.recipeType = requireNonNull(recipeType, "No recipeType provided");
            this.ingredients = ingredients != null ? List.copyOf(ingredients) : List.of();
            this.instructions = instructions != null ? List.copyOf(instructions) : List.of();
            this.prepTimeMin = prepTimeMin;
            this.cookTimeMin = cookTimeMin;
            this.advancePrepHours = advancePrepHours;
            this.servingSize = servingSize;
        }

        @Override
        public String toString() {
            return "CreateRecipe{recipeId=" + recipeId + ", ownerId=" + ownerId + ", title='" + title + "'}";
        }
    }

    public static final class UpdateRecipe {
        public final RecipeId         recipeId;
        public final UserId           requestedBy;
        public final String           title;
        public final int              prepTimeMin;
        public final int              cookTimeMin;
        public final int              advancePrepHours;
        public final int              servingSize;
        public final List<Ingredient> ingredients;

        public UpdateRecipe(RecipeId recipeId,
                            UserId requestedBy,
                            String title,
                            int prepTimeMin,
                            int cookTimeMin,
                            int advancePrepHours,
                            int servingSize,
                            List<Ingredient> ingredients) {
            this.recipeId = requireNonNull(recipeId, "No recipeId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
            this.title = title;
            this.prepTimeMin = prepTimeMin;
            this.cookTimeMin = cookTimeMin;
            this.advancePrepHours = advancePrepHours;
            this.servingSize = servingSize;
            this.ingredients = ingredients != null ? List.copyOf(ingredients) : List.of();
        }

        @Override
        public String toString() {
            return "UpdateRecipe{recipeId=" + recipeId + ", requestedBy=" + requestedBy + "}";
        }
    }

    /**
     * Mark or unmark a recipe as favorite. Requesting the current value is a no-op
     */
    public static final class FavoriteRecipe implements IdempotentCommand {
        public final RecipeId recipeId;
        public final UserId   requestedBy;
        public final boolean  favorited;

        public FavoriteRecipe(RecipeId recipeId, UserId requestedBy, boolean favorited) {
            this.recipeId = requireNonNull(recipeId, "No recipeId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
            this.favorited = favorited;
        }

        @Override
        public String toString() {
            return "FavoriteRecipe{recipeId=" + recipeId + ", favorited=" + favorited + "}";
        }
    }

    public static final class ShareRecipe implements IdempotentCommand {
        public final RecipeId recipeId;
        public final UserId   requestedBy;
        public final boolean  shared;

        public ShareRecipe(RecipeId recipeId, UserId requestedBy, boolean shared) {
            this.recipeId = requireNonNull(recipeId, "No recipeId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
            this.shared = shared;
        }

        @Override
        public String toString() {
            return "ShareRecipe{recipeId=" + recipeId + ", shared=" + shared + "}";
        }
    }

    public static final class DeleteRecipe {
        public final RecipeId recipeId;
        public final UserId   requestedBy;

        public DeleteRecipe(RecipeId recipeId, UserId requestedBy) {
            this.recipeId = requireNonNull(recipeId, "No recipeId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
        }

        @Override
        public String toString() {
            return "DeleteRecipe{recipeId=" + recipeId + "}";
        }
    }
}
