package dk.cloudcreate.imkitchen.mealplanning.mealplan;

public interface MealPlanEventVisitor<C, R> {
    R on(MealPlanEvent.MealPlanGenerated event, C context);

    R on(MealPlanEvent.MealReplaced event, C context);

    R on(MealPlanEvent.MealPlanArchived event, C context);
}
