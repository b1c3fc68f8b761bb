package dk.cloudcreate.imkitchen.mealplanning.user;

/**
 * One method per {@link UserEvent} type, so adding an event type breaks every aggregate and projection that doesn't handle it
 *
 * @param <C> the context passed along with the event (e.g. the current state or a database handle)
 * @param <R> the result
 */
public interface UserEventVisitor<C, R> {
    R on(UserEvent.UserCreated event, C context);

    R on(UserEvent.SubscriptionTierChanged event, C context);

    R on(UserEvent.UserSuspended event, C context);

    R on(UserEvent.UserReactivated event, C context);
}
