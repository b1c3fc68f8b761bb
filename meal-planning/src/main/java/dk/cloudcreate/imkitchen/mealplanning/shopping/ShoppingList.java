package dk.cloudcreate.imkitchen.mealplanning.shopping;

import dk.cloudcreate.imkitchen.aggregates.EventSourcedAggregate;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.mealplanning.types.ShoppingListId;

import java.util.Set;

public class ShoppingList implements EventSourcedAggregate<ShoppingListId, ShoppingListEvent, ShoppingListState>,
        ShoppingListEventVisitor<ShoppingListState, ShoppingListState> {
    public static final AggregateType SHOPPING_LISTS = AggregateType.of("ShoppingLists");

    public static AggregateTypeConfiguration aggregateTypeConfiguration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(SHOPPING_LISTS, jsonSerializer)
                                         .registerEventType("ShoppingListGenerated", ShoppingListEvent.ShoppingListGenerated.class)
                                         .registerEventType("ShoppingListItemCollected", ShoppingListEvent.ShoppingListItemCollected.class);
    }

    @Override
    public AggregateType aggregateType() {
        return SHOPPING_LISTS;
    }

    @Override
    public Class<ShoppingListEvent> eventType() {
        return ShoppingListEvent.class;
    }

    @Override
    public ShoppingListState initialState() {
        return ShoppingListState.NOT_GENERATED;
    }

    @Override
    public ShoppingListState apply(ShoppingListState state, ShoppingListEvent event) {
        return event.accept(this, state);
    }

    @Override
    public ShoppingListState on(ShoppingListEvent.ShoppingListGenerated event, ShoppingListState state) {
        return new ShoppingListState(event.shoppingListId, event.userId, event.mealPlanId, event.weekStartDate, event.items, Set.of());
    }

    @Override
    public ShoppingListState on(ShoppingListEvent.ShoppingListItemCollected event, ShoppingListState state) {
        return state.withCollected(event.itemIndex, event.collected);
    }
}
