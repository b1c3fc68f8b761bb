package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.LocalDate;
import java.util.Objects;

/**
 * The recipe planned for one course of one day
 */
public final class MealAssignment {
    public static final String REPLACED_BY_USER = "Replaced by the user";

    public final LocalDate  date;
    public final CourseType courseType;
    public final RecipeId   recipeId;
    /**
     * True if the recipe must be prepared ahead of the day (advance prep hours &gt; 0)
     */
    public final boolean    prepRequired;
    /**
     * Human readable explanation of why the recipe was picked
     */
    public final String     reasoning;

    @JsonCreator
    public MealAssignment(LocalDate date, CourseType courseType, RecipeId recipeId, boolean prepRequired, String reasoning) {
        this.date = date;
        this.courseType = courseType;
        this.recipeId = recipeId;
        this.prepRequired = prepRequired;
        this.reasoning = reasoning;
    }

    MealAssignment withRecipe(RecipeId recipeId, boolean prepRequired, String reasoning) {
        return new MealAssignment(date, courseType, recipeId, prepRequired, reasoning);
    }

    public boolean isFor(LocalDate date, CourseType courseType) {
        return this.date.equals(date) && this.courseType == courseType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MealAssignment)) return false;
        var that = (MealAssignment) o;
        return prepRequired == that.prepRequired &&
                Objects.equals(date, that.date) &&
                courseType == that.courseType &&
                Objects.equals(recipeId, that.recipeId) &&
                Objects.equals(reasoning, that.reasoning);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, courseType, recipeId, prepRequired, reasoning);
    }

    @Override
    public String toString() {
        return date + " " + courseType + ": " + recipeId;
    }
}
