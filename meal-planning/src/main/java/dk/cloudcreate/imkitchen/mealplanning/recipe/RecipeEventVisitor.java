package dk.cloudcreate.imkitchen.mealplanning.recipe;

public interface RecipeEventVisitor<C, R> {
    R on(RecipeEvent.RecipeCreated event, C context);

    R on(RecipeEvent.RecipeUpdated event, C context);

    R on(RecipeEvent.RecipeFavorited event, C context);

    R on(RecipeEvent.RecipeShared event, C context);

    R on(RecipeEvent.RecipeDeleted event, C context);
}
