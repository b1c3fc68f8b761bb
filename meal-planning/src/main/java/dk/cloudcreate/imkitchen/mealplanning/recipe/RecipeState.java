package dk.cloudcreate.imkitchen.mealplanning.recipe;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable state of a {@link Recipe} together with the decisions that can be made from it
 */
public final class RecipeState {
    public static final RecipeState NOT_CREATED = new RecipeState(null, null, null, null, List.of(), 0, 0, 0, 0, false, false, false);

    public final RecipeId         recipeId;
    public final UserId           ownerId;
    public final String           title;
    public final CourseType       recipeType;
    public final List<Ingredient> ingredients;
    public final int              prepTimeMin;
    public final int              cookTimeMin;
    public final int              advancePrepHours;
    public final int              servingSize;
    public final boolean          favorited;
    public final boolean          shared;
    public final boolean          deleted;

    RecipeState(RecipeId recipeId,
                UserId ownerId,
                String title,
                CourseType recipeType,
                List<Ingredient> ingredients,
                int prepTimeMin,
                int cookTimeMin,
                int advancePrepHours,
                int servingSize,
                boolean favorited,
                boolean shared,
                boolean deleted) {
        this.recipeId = recipeId;
        this.ownerId = ownerId;
        this.title = title;
        this.recipeType = recipeType;
        this.ingredients = List.copyOf(ingredients);
        this.prepTimeMin = prepTimeMin;
        this.cookTimeMin = cookTimeMin;
        this.advancePrepHours = advancePrepHours;
        this.servingSize = servingSize;
        this.favorited = favorited;
        this.shared = shared;
        this.deleted = deleted;
    }

    public boolean isCreated() {
        return recipeId != null;
    }

    public List<RecipeEvent> create(RecipeCommands.CreateRecipe command, Instant now) {
        if (isCreated()) {
            throw new InvalidStateException(msg("Recipe '{}' already exists", recipeId));
        }
        validateDetails(command.title, command.ingredients, command.prepTimeMin, command.cookTimeMin, command.advancePrepHours, command.servingSize);
        if (command.instructions.isEmpty()) {
            throw new ConstraintViolationException("A recipe needs at least one instruction step");
        }
        return List.of(new RecipeEvent.RecipeCreated(command.recipeId,
                                                     command.ownerId,
                                                     command.title.trim(),
                                                     command.recipeType,
                                                     command.ingredients,
                                                     command.instructions,
                                                     command.prepTimeMin,
                                                     command.cookTimeMin,
                                                     command.advancePrepHours,
                                                     command.servingSize,
                                                     now));
    }

    public List<RecipeEvent> update(RecipeCommands.UpdateRecipe command, Instant now) {
        requireMutableBy(command.requestedBy, "update");
        validateDetails(command.title, command.ingredients, command.prepTimeMin, command.cookTimeMin, command.advancePrepHours, command.servingSize);
        return List.of(new RecipeEvent.RecipeUpdated(recipeId,
                                                     ownerId,
                                                     command.title.trim(),
                                                     command.prepTimeMin,
                                                     command.cookTimeMin,
                                                     command.advancePrepHours,
                                                     command.servingSize,
                                                     command.ingredients,
                                                     now));
    }

    public List<RecipeEvent> favorite(UserId requestedBy, boolean favorite, Instant now) {
        requireMutableBy(requestedBy, "favorite");
        if (favorited == favorite) {
            return List.of();
        }
        return List.of(new RecipeEvent.RecipeFavorited(recipeId, ownerId, favorite, now));
    }

    public List<RecipeEvent> share(UserId requestedBy, boolean share, Instant now) {
        requireMutableBy(requestedBy, "share");
        if (shared == share) {
            return List.of();
        }
        return List.of(new RecipeEvent.RecipeShared(recipeId, ownerId, share, now));
    }

    public List<RecipeEvent> delete(UserId requestedBy, Instant now) {
        requireMutableBy(requestedBy, "delete");
        return List.of(new RecipeEvent.RecipeDeleted(recipeId, ownerId, now));
    }

    private void requireMutableBy(UserId requestedBy, String action) {
        if (!isCreated()) {
            throw new InvalidStateException(msg("Cannot {} a recipe that doesn't exist", action));
        }
        if (deleted) {
            throw new InvalidStateException(msg("Cannot {} a deleted recipe", action));
        }
        if (!ownerId.equals(requestedBy)) {
            throw new ConstraintViolationException(msg("Only the owner of recipe '{}' can {} it", recipeId, action));
        }
    }

    private static void validateDetails(String title,
                                        List<Ingredient> ingredients,
                                        int prepTimeMin,
                                        int cookTimeMin,
                                        int advancePrepHours,
                                        int servingSize) {
        if (title == null || title.isBlank()) {
            throw new ConstraintViolationException("A recipe needs a title");
        }
        if (ingredients.isEmpty()) {
            throw new ConstraintViolationException("A recipe needs at least one ingredient");
        }
        for (var ingredient : ingredients) {
            if (ingredient.name == null || ingredient.name.isBlank()) {
                throw new ConstraintViolationException("An ingredient needs a name");
            }
            if (ingredient.quantity == null || ingredient.quantity.compareTo(BigDecimal.ZERO) <= 0) {
                throw new ConstraintViolationException(msg("Ingredient '{}' needs a positive quantity", ingredient.name));
            }
        }
        if (prepTimeMin < 0 || cookTimeMin < 0 || advancePrepHours < 0) {
            throw new ConstraintViolationException("Times can't be negative");
        }
        if (servingSize < 1) {
            throw new ConstraintViolationException("A recipe serves at least one person");
        }
    }

    RecipeState withDetails(String title, List<Ingredient> ingredients, int prepTimeMin, int cookTimeMin, int advancePrepHours, int servingSize) {
        return new RecipeState(recipeId, ownerId, title, recipeType, ingredients, prepTimeMin, cookTimeMin, advancePrepHours, servingSize, favorited, shared, deleted);
    }

    RecipeState withFavorited(boolean favorited) {
        return new RecipeState(recipeId, ownerId, title, recipeType, ingredients, prepTimeMin, cookTimeMin, advancePrepHours, servingSize, favorited, shared, deleted);
    }

    RecipeState withShared(boolean shared) {
        return new RecipeState(recipeId, ownerId, title, recipeType, ingredients, prepTimeMin, cookTimeMin, advancePrepHours, servingSize, favorited, shared, deleted);
    }

    RecipeState asDeleted() {
        return new RecipeState(recipeId, ownerId, title, recipeType, ingredients, prepTimeMin, cookTimeMin, advancePrepHours, servingSize, favorited, shared, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecipeState)) return false;
        var that = (RecipeState) o;
        return prepTimeMin == that.prepTimeMin &&
                cookTimeMin == that.cookTimeMin &&
                advancePrepHours == that.advancePrepHours &&
                servingSize == that.servingSize &&
                favorited == that.favorited &&
                shared == that.shared &&
                deleted == that.deleted &&
                Objects.equals(recipeId, that.recipeId) &&
                Objects.equals(ownerId, that.ownerId) &&
                Objects.equals(title, that.title) &&
                recipeType == that.recipeType &&
                Objects.equals(ingredients, that.ingredients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(recipeId, ownerId, title, recipeType, favorited, shared, deleted);
    }

    @Override
    public String toString() {
        return "RecipeState{" +
                "recipeId=" + recipeId +
                ", ownerId=" + ownerId +
                ", title='" + title + '\'' +
                ", recipeType=" + recipeType +
                ", favorited=" + favorited +
                ", shared=" + shared +
                ", deleted=" + deleted +
                '}';
    }
}
