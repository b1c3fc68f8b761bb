package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.LocalDate;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class MealPlanCommands {
    private MealPlanCommands() {
    }

    /**
     * Generate a meal plan from the user's favorite recipes. The user's current active meal plan, if any, is archived
     */
    public static final class GenerateMealPlan {
        public final MealPlanId mealPlanId;
        public final UserId     userId;
        /**
         * Must be a Monday
         */
        public final LocalDate  startDate;
        public final int        weeks;

        public GenerateMealPlan(MealPlanId mealPlanId, UserId userId, LocalDate startDate, int weeks) {
            this.mealPlanId = requireNonNull(mealPlanId, "No mealPlanId provided");
            this.userId = requireNonNull(userId, "No userId provided");
            this.startDate = startDate;
            this.weeks = weeks;
        }

        public GenerateMealPlan(UserId userId, LocalDate startDate, int weeks) {
            this(MealPlanId.random(), userId, startDate, weeks);
        }

        @Override
        public String toString() {
            return "GenerateMealPlan{mealPlanId=" + mealPlanId + ", userId=" + userId + ", startDate=" + startDate + ", weeks=" + weeks + "}";
        }
    }

    public static final class ReplaceMeal {
        public final MealPlanId mealPlanId;
        public final UserId     requestedBy;
        public final LocalDate  date;
        public final CourseType courseType;
        public final RecipeId   newRecipeId;

        public ReplaceMeal(MealPlanId mealPlanId, UserId requestedBy, LocalDate date, CourseType courseType, RecipeId newRecipeId) {
            this.mealPlanId = requireNonNull(mealPlanId, "No mealPlanId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
            this.date = requireNonNull(date, "No date provided");
            this.courseType = requireNonNull(courseType, "No courseType provided");
            this.newRecipeId = requireNonNull(newRecipeId, "No newRecipeId provided");
        }

        @Override
        public String toString() {
            return "ReplaceMeal{mealPlanId=" + mealPlanId + ", date=" + date + ", courseType=" + courseType + ", newRecipeId=" + newRecipeId + "}";
        }
    }

    public static final class ArchiveMealPlan {
        public final MealPlanId mealPlanId;
        public final UserId     requestedBy;

        public ArchiveMealPlan(MealPlanId mealPlanId, UserId requestedBy) {
            this.mealPlanId = requireNonNull(mealPlanId, "No mealPlanId provided");
            this.requestedBy = requireNonNull(requestedBy, "No requestedBy provided");
        }

        @Override
        public String toString() {
            return "ArchiveMealPlan{mealPlanId=" + mealPlanId + "}";
        }
    }
}
