package dk.cloudcreate.imkitchen.mealplanning.user;

import com.fasterxml.jackson.annotation.JsonCreator;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.Instant;

/**
 * Events of the {@link User} aggregate
 */
public abstract class UserEvent {
    public final UserId userId;

    protected UserEvent(UserId userId) {
        this.userId = userId;
    }

    public abstract <C, R> R accept(UserEventVisitor<C, R> visitor, C context);

    public static final class UserCreated extends UserEvent {
        public final String  email;
        public final Instant createdAt;

        @JsonCreator
        public UserCreated(UserId userId, String email, Instant createdAt) {
            super(userId);
            this.email = email;
            this.createdAt = createdAt;
        }

        @Override
        public <C, R> R accept(UserEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class SubscriptionTierChanged extends UserEvent {
        public final SubscriptionTier tier;
        public final Instant          changedAt;

        @JsonCreator
        public SubscriptionTierChanged(UserId userId, SubscriptionTier tier, Instant changedAt) {
            super(userId);
            this.tier = tier;
            this.changedAt = changedAt;
        }

        @Override
        public <C, R> R accept(UserEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class UserSuspended extends UserEvent {
        public final String  reason;
        public final Instant suspendedAt;

        @JsonCreator
        public UserSuspended(UserId userId, String reason, Instant suspendedAt) {
            super(userId);
            this.reason = reason;
            this.suspendedAt = suspendedAt;
        }

        @Override
        public <C, R> R accept(UserEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }

    public static final class UserReactivated extends UserEvent {
        public final Instant reactivatedAt;

        @JsonCreator
        public UserReactivated(UserId userId, Instant reactivatedAt) {
            super(userId);
            this.reactivatedAt = reactivatedAt;
        }

        @Override
        public <C, R> R accept(UserEventVisitor<C, R> visitor, C context) {
            return visitor.on(this, context);
        }
    }
}
