package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.aggregates.EventSourcedAggregate;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.mealplanning.types.MealPlanId;

public class MealPlan implements EventSourcedAggregate<MealPlanId, MealPlanEvent, MealPlanState>, MealPlanEventVisitor<MealPlanState, MealPlanState> {
    public static final AggregateType MEAL_PLANS = AggregateType.of("MealPlans");

    public static AggregateTypeConfiguration aggregateTypeConfiguration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(MEAL_PLANS, jsonSerializer)
                                         .registerEventType("MealPlanGenerated", MealPlanEvent.MealPlanGenerated.class)
                                         .registerEventType("MealReplaced", MealPlanEvent.MealReplaced.class)
                                         .registerEventType("MealPlanArchived", MealPlanEvent.MealPlanArchived.class);
    }

    @Override
    public AggregateType aggregateType() {
        return MEAL_PLANS;
    }

    @Override
    public Class<MealPlanEvent> eventType() {
        return MealPlanEvent.class;
    }

    @Override
    public MealPlanState initialState() {
        return MealPlanState.UNINITIALIZED;
    }

    @Override
    public MealPlanState apply(MealPlanState state, MealPlanEvent event) {
        return event.accept(this, state);
    }

    @Override
    public MealPlanState on(MealPlanEvent.MealPlanGenerated event, MealPlanState state) {
        return new MealPlanState(event.mealPlanId, event.userId, event.startDate, event.weeks, MealPlanState.Status.ACTIVE);
    }

    @Override
    public MealPlanState on(MealPlanEvent.MealReplaced event, MealPlanState state) {
        return state.withReplacedMeal(event.date, event.courseType, event.newRecipeId, event.prepRequired);
    }

    @Override
    public MealPlanState on(MealPlanEvent.MealPlanArchived event, MealPlanState state) {
        return state.asArchived();
    }
}
