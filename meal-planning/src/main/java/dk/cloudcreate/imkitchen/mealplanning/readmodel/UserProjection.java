package dk.cloudcreate.imkitchen.mealplanning.readmodel;

import dk.cloudcreate.imkitchen.eventstore.eventstream.*;
import dk.cloudcreate.imkitchen.eventstore.types.EventType;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.mealplanning.user.*;
import dk.cloudcreate.imkitchen.projections.TypedProjectionHandler;
import org.jdbi.v3.core.Handle;

import java.time.Instant;
import java.util.Set;

/**
 * Maintains the <code>users</code> read model
 */
public class UserProjection extends TypedProjectionHandler<UserEvent> implements UserEventVisitor<Handle, Void> {
    public static final String NAME  = "user_projection";
    public static final String USERS = "users";

    public UserProjection() {
        super(UserEvent.class);
    }

    @Override
    public String projectionName() {
        return NAME;
    }

    @Override
    public Set<AggregateType> aggregateTypes() {
        return Set.of(User.USERS);
    }

    @Override
    public Set<EventType> interestedEventTypes() {
        return Set.of(EventType.of("UserCreated"),
                      EventType.of("SubscriptionTierChanged"),
                      EventType.of("UserSuspended"),
                      EventType.of("UserReactivated"));
    }

    @Override
    public void initializeReadModel(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS " + USERS + " (\n" +
                               "    id         text PRIMARY KEY,\n" +
                               "    email      text NOT NULL,\n" +
                               "    tier       text NOT NULL,\n" +
                               "    status     text NOT NULL,\n" +
                               "    created_at timestamptz NOT NULL,\n" +
                               "    updated_at timestamptz NOT NULL\n" +
                               ")");
    }

    @Override
    public void resetReadModel(Handle handle) {
        handle.execute("TRUNCATE " + USERS);
    }

    @Override
    protected void handle(Handle handle, PersistedEvent persistedEvent, UserEvent event) {
        event.accept(this, handle);
    }

    @Override
    public Void on(UserEvent.UserCreated event, Handle handle) {
        handle.createUpdate("INSERT INTO " + USERS + " (id, email, tier, status, created_at, updated_at)\n" +
                                    "VALUES (:id, :email, :tier, :status, :createdAt, :createdAt)\n" +
                                    "ON CONFLICT (id) DO UPDATE SET email = EXCLUDED.email, tier = EXCLUDED.tier, status = EXCLUDED.status,\n" +
                                    "    created_at = EXCLUDED.created_at, updated_at = EXCLUDED.updated_at")
              .bind("id", event.userId.toString())
              .bind("email", event.email)
              .bind("tier", SubscriptionTier.FREE.name())
              .bind("status", UserState.Status.ACTIVE.name())
              .bind("createdAt", event.createdAt)
              .execute();
        return null;
    }

    @Override
    public Void on(UserEvent.SubscriptionTierChanged event, Handle handle) {
        update(handle, event.userId, "tier", event.tier.name(), event.changedAt);
        return null;
    }

    @Override
    public Void on(UserEvent.UserSuspended event, Handle handle) {
        update(handle, event.userId, "status", UserState.Status.SUSPENDED.name(), event.suspendedAt);
        return null;
    }

    @Override
    public Void on(UserEvent.UserReactivated event, Handle handle) {
        update(handle, event.userId, "status", UserState.Status.ACTIVE.name(), event.reactivatedAt);
        return null;
    }

    private static void update(Handle handle, UserId userId, String column, String value, Instant updatedAt) {
        handle.createUpdate("UPDATE " + USERS + " SET " + column + " = :value, updated_at = :updatedAt WHERE id = :id")
              .bind("id", userId.toString())
              .bind("value", value)
              .bind("updatedAt", updatedAt)
              .execute();
    }
}
