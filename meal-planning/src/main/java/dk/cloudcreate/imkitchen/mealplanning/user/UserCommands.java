package dk.cloudcreate.imkitchen.mealplanning.user;

import dk.cloudcreate.imkitchen.aggregates.command.IdempotentCommand;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

public final class UserCommands {
    private UserCommands() {
    }

    /**
     * Register a new user. The email is normalized to lower case and must be unique across users
     */
    public static final class RegisterUser {
        public final UserId userId;
        public final String email;

        public RegisterUser(UserId userId, String email) {
            this.userId = requireNonNull(userId, "No userId provided");
            this.email = email;
        }

        public RegisterUser(String email) {
            this(UserId.random(), email);
        }

        @Override
        public String toString() {
            return "RegisterUser{userId=" + userId + "}";
        }
    }

    public static final class ChangeSubscriptionTier implements IdempotentCommand {
        public final UserId           userId;
        public final SubscriptionTier tier;

        public ChangeSubscriptionTier(UserId userId, SubscriptionTier tier) {
            this.userId = requireNonNull(userId, "No userId provided");
            this.tier = requireNonNull(tier, "No tier provided");
        }

        @Override
        public String toString() {
            return "ChangeSubscriptionTier{userId=" + userId + ", tier=" + tier + "}";
        }
    }

    public static final class SuspendUser {
        public final UserId userId;
        public final String reason;

        public SuspendUser(UserId userId, String reason) {
            this.userId = requireNonNull(userId, "No userId provided");
            this.reason = reason;
        }

        @Override
        public String toString() {
            return "SuspendUser{userId=" + userId + "}";
        }
    }

    public static final class ReactivateUser {
        public final UserId userId;

        public ReactivateUser(UserId userId) {
            this.userId = requireNonNull(userId, "No userId provided");
        }

        @Override
        public String toString() {
            return "ReactivateUser{userId=" + userId + "}";
        }
    }
}
