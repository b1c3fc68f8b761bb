package dk.cloudcreate.imkitchen.mealplanning.recipe;

import dk.cloudcreate.imkitchen.aggregates.EventSourcedAggregate;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.mealplanning.types.RecipeId;

public class Recipe implements EventSourcedAggregate<RecipeId, RecipeEvent, RecipeState>, RecipeEventVisitor<RecipeState, RecipeState> {
    public static final AggregateType RECIPES = AggregateType.of("Recipes");

    public static AggregateTypeConfiguration aggregateTypeConfiguration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(RECIPES, jsonSerializer)
                                         .registerEventType("RecipeCreated", RecipeEvent.RecipeCreated.class)
                                         .registerEventType("RecipeUpdated", RecipeEvent.RecipeUpdated.class)
                                         .registerEventType("RecipeFavorited", RecipeEvent.RecipeFavorited.class)
                                         .registerEventType("RecipeShared", RecipeEvent.RecipeShared.class)
                                         .registerEventType("RecipeDeleted", RecipeEvent.RecipeDeleted.class);
    }

    @Override
    public AggregateType aggregateType() {
        return RECIPES;
    }

    @Override
    public Class<RecipeEvent> eventType() {
        return RecipeEvent.class;
    }

    @Override
    public RecipeState initialState() {
        return RecipeState.NOT_CREATED;
    }

    @Override
    public RecipeState apply(RecipeState state, RecipeEvent event) {
        return event.accept(this, state);
    }

    @Override
    public RecipeState on(RecipeEvent.RecipeCreated event, RecipeState state) {
        return new RecipeState(event.recipeId,
                               event.ownerId,
                               event.title,
                               event.recipeType,
                               event.ingredients,
                               event.prepTimeMin,
                               event.cookTimeMin,
                               event.advancePrepHours,
                               event.servingSize,
                               false,
                               false,
                               false);
    }

    @Override
    public RecipeState on(RecipeEvent.RecipeUpdated event, RecipeState state) {
        return state.withDetails(event.title, event.ingredients, event.prepTimeMin, event.cookTimeMin, event.advancePrepHours, event.servingSize);
    }

    @Override
    public RecipeState on(RecipeEvent.RecipeFavorited event, RecipeState state) {
        return state.withFavorited(event.favorited);
    }

    @Override
    public RecipeState on(RecipeEvent.RecipeShared event, RecipeState state) {
        return state.withShared(event.shared);
    }

    @Override
    public RecipeState on(RecipeEvent.RecipeDeleted event, RecipeState state) {
        return state.asDeleted();
    }
}
