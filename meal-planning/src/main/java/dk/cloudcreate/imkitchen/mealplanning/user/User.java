package dk.cloudcreate.imkitchen.mealplanning.user;

import dk.cloudcreate.imkitchen.aggregates.EventSourcedAggregate;
import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;
import dk.cloudcreate.imkitchen.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.imkitchen.eventstore.serializer.JSONSerializer;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

public class User implements EventSourcedAggregate<UserId, UserEvent, UserState>, UserEventVisitor<UserState, UserState> {
    public static final AggregateType USERS = AggregateType.of("Users");

    public static AggregateTypeConfiguration aggregateTypeConfiguration(JSONSerializer jsonSerializer) {
        return AggregateTypeConfiguration.standardConfigurationFor(USERS, jsonSerializer)
                                         .registerEventType("UserCreated", UserEvent.UserCreated.class)
                                         .registerEventType("SubscriptionTierChanged", UserEvent.SubscriptionTierChanged.class)
                                         .registerEventType("UserSuspended", UserEvent.UserSuspended.class)
                                         .registerEventType("UserReactivated", UserEvent.UserReactivated.class);
    }

    @Override
    public AggregateType aggregateType() {
        return USERS;
    }

    @Override
    public Class<UserEvent> eventType() {
        return UserEvent.class;
    }

    @Override
    public UserState initialState() {
        return UserState.UNINITIALIZED;
    }

    @Override
    public UserState apply(UserState state, UserEvent event) {
        return event.accept(this, state);
    }

    @Override
    public UserState on(UserEvent.UserCreated event, UserState state) {
        return new UserState(event.userId, event.email, SubscriptionTier.FREE, UserState.Status.ACTIVE);
    }

    @Override
    public UserState on(UserEvent.SubscriptionTierChanged event, UserState state) {
        return state.withTier(event.tier);
    }

    @Override
    public UserState on(UserEvent.UserSuspended event, UserState state) {
        return state.withStatus(UserState.Status.SUSPENDED);
    }

    @Override
    public UserState on(UserEvent.UserReactivated event, UserState state) {
        return state.withStatus(UserState.Status.ACTIVE);
    }
}
