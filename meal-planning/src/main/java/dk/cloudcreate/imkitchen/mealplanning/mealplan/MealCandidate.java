package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.mealplanning.types.*;

/**
 * A favorite recipe that may be assigned to a meal
 */
public final class MealCandidate {
    public final RecipeId   recipeId;
    public final CourseType recipeType;
    public final int        advancePrepHours;

    public MealCandidate(RecipeId recipeId, CourseType recipeType, int advancePrepHours) {
        this.recipeId = recipeId;
        this.recipeType = recipeType;
        this.advancePrepHours = advancePrepHours;
    }

    public boolean prepRequired() {
        return advancePrepHours > 0;
    }

    @Override
    public String toString() {
        return recipeId + " (" + recipeType + ")";
    }
}
