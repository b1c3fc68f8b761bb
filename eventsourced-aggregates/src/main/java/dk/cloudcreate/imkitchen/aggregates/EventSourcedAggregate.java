package dk.cloudcreate.imkitchen.aggregates;

import dk.cloudcreate.imkitchen.eventstore.eventstream.AggregateType;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Describes how the state of an aggregate is derived from its events.<br>
 * The aggregate itself has no identity or mutable fields: the state is the left fold of {@link #apply(Object, Object)}
 * over the event stream, starting from {@link #initialState()}, which makes replaying the same events always yield the same state.<br>
 * <br>
 * Command decisions are pure methods (typically on the state class) that take the current state and the command input and either
 * return the events to append or throw a {@link DomainException}:
 * <pre>{@code
 * public List<RecipeEvent> favorite(RecipeState state, UserId requestedBy, Instant now) {
 *     if (state.deleted) throw new InvalidStateException("Cannot favorite a deleted recipe");
 *     if (state.favorited) return List.of();
 *     return List.of(new RecipeFavorited(state.recipeId, requestedBy, true, now));
 * }
 * }</pre>
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the base type of the aggregate's events
 * @param <STATE> the (immutable) state type
 */
public interface EventSourcedAggregate<ID, EVENT, STATE> {
    AggregateType aggregateType();

    /**
     * The base type of the events of this aggregate. Used to verify the events loaded from the event store
     */
    Class<EVENT> eventType();

    /**
     * The state of an aggregate that doesn't have any events yet
     */
    STATE initialState();

    /**
     * Fold a single event into the state. Must be total (every event type is handled) and free of side effects
     */
    STATE apply(STATE state, EVENT event);

    default STATE rehydrate(List<? extends EVENT> events) {
        requireNonNull(events, "No events provided");
        var state = initialState();
        for (EVENT event : events) {
            state = apply(state, event);
        }
        return state;
    }
}
