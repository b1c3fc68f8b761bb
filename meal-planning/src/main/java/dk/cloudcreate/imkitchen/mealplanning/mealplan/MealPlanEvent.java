package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.*;
import java.util.List;

/**
 * Events of the {@link MealPlan} aggregate
 */
public abstract class MealPlanEvent {
    public final MealPlanId mealPlanId;
    public final UserId     userId;

    protected MealPlanEvent(MealPlanId mealPlanId, UserId userId) {
        this.mealPlanId = mealPlanId;
        this.userId = userId;
    }

    public abstract <C, R> R accept(MealPlanEventVisitor<C, R> visitor, C context);

    public static final class MealPlanGenerated extends MealPlanEvent {
        public final LocalDate      startDate;
        public final List<WeekPlan> weeks;
        public final Instant        generatedAt;

        @JsonCreator
        public MealPlanGenerated(MealPlanId mealPlanId, UserId userId, LocalDate startDate, List<WeekPlan> weeks, Instant generatedAt) {
            super(mealPlanId, userId);
            this.startDate = startDate;
            this.weeks = weeks;
            this.generatedAt = generatedAt;
        }

        public LocalDate endDate() {
            return startDate.plusWeeks(weeks.size()).minusDays(1);
        }

        @Override
        public <C, R> R accept(MealPlanEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class MealReplaced extends MealPlanEvent {
        public final LocalDate  date;
        public final CourseType courseType;
        public final RecipeId   previousRecipeId;
        public final RecipeId   newRecipeId;
        public final boolean    prepRequired;
        public final Instant    replacedAt;

        @JsonCreator
        public MealReplaced(MealPlanId mealPlanId,
                            UserId userId,
                            LocalDate date,
                            CourseType courseType,
                            RecipeId previousRecipeId,
                            RecipeId newRecipeId,
                            boolean prepRequired,
                            Instant replacedAt) {
            super(mealPlanId, userId);
            this.date = date;
            this.courseType = courseType;
            this.previousRecipeId = previousRecipeId;
            this.newRecipeId = newRecipeId;
            this.prepRequired = prepRequired;
            this.replacedAt = replacedAt;
        }

        @Override
        public <C, R> R accept(MealPlanEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class MealPlanArchived extends MealPlanEvent {
        public final Instant archivedAt;

        @JsonCreator
        public MealPlanArchived(MealPlanId mealPlanId, UserId userId, Instant archivedAt) {
            super(mealPlanId, userId);
            this.archivedAt = archivedAt;
        }

        @Override
        public <C, R> R accept(MealPlanEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }
}
