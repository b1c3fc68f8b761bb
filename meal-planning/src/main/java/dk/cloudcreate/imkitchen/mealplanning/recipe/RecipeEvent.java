package dk.cloudcreate.imkitchen.mealplanning.recipe;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.Instant;
import java.util.List;

/**
 * Events of the {@link Recipe} aggregate. Every event carries the owner, so projections can maintain per user read models
 * without loading the recipe
 */
public abstract class RecipeEvent {
    public final RecipeId recipeId;
    public final UserId   ownerId;

    protected RecipeEvent(RecipeId recipeId, UserId ownerId) {
        this.recipeId = recipeId;
        this.ownerId = ownerId;
    }

    public abstract <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context);

    public static final class RecipeCreated extends RecipeEvent {
        public final String                title;
        public final CourseType            recipeType;
        public final List<Ingredient>      ingredients;
        public final List<InstructionStep> instructions;
        public final int                   prepTimeMin;
        public final int                   cookTimeMin;
        public final int                   advancePrepHours;
        public final int                   servingSize;
        public final Instant               createdAt;

        @JsonCreator
        public RecipeCreated(RecipeId recipeId,
                             UserId ownerId,
                             String title,
                             CourseType recipeType,
                             List<Ingredient> ingredients,
                             List<InstructionStep> instructions,
                             int prepTimeMin,
                             int cookTimeMin,
                             int advancePrepHours,
                             int servingSize,
                             Instant createdAt) {
            super(recipeId, ownerId);
            this.title = title;
            this.recipeType = recipeType;
            this.ingredients = ingredients;
            this.instructions = instructions;
            this.prepTimeMin = prepTimeMin;
            this.cookTimeMin = cookTimeMin;
            this.advancePrepHours = advancePrepHours;
            this.servingSize = servingSize;
            this.createdAt = createdAt;
        }

        @Override
        public <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class RecipeUpdated extends RecipeEvent {
        public final String           title;
        public final int              prepTimeMin;
        public final int              cookTimeMin;
        public final int              advancePrepHours;
        public final int              servingSize;
        public final List<Ingredient> ingredients;
        public final Instant          updatedAt;

        @JsonCreator
        public RecipeUpdated(RecipeId recipeId,
                             UserId ownerId,
                             String title,
                             int prepTimeMin,
                             int cookTimeMin,
                             int advancePrepHours,
                             int servingSize,
                             List<Ingredient> ingredients,
                             Instant updatedAt) {
            super(recipeId, ownerId);
            this.title = title;
            this.prepTimeMin = prepTimeMin;
            this.cookTimeMin = cookTimeMin;
            this.advancePrepHours = advancePrepHours;
            this.servingSize = servingSize;
            this.ingredients = ingredients;
            this.updatedAt = updatedAt;
        }

        @Override
        public <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class RecipeFavorited extends RecipeEvent {
        public final boolean favorited;
        public final Instant toggledAt;

        @JsonCreator
        public RecipeFavorited(RecipeId recipeId, UserId ownerId, boolean favorited, Instant toggledAt) {
            super(recipeId, ownerId);
            this.favorited = favorited;
            this.toggledAt = toggledAt;
        }

        @Override
        public <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class RecipeShared extends RecipeEvent {
        public final boolean shared;
        public final Instant sharedAt;

        @JsonCreator
        public RecipeShared(RecipeId recipeId, UserId ownerId, boolean shared, Instant sharedAt) {
            super(recipeId, ownerId);
            this.shared = shared;
            this.sharedAt = sharedAt;
        }

        @Override
        public <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class RecipeDeleted extends RecipeEvent {
        public final Instant deletedAt;

        @JsonCreator
        public RecipeDeleted(RecipeId recipeId, UserId ownerId, Instant deletedAt) {
            super(recipeId, ownerId);
            this.deletedAt = deletedAt;
        }

        @Override
        public <C, R> R accept(RecipeEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }
}
