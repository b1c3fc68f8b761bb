package dk.cloudcreate.imkitchen.mealplanning.user;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable state of a {@link User} together with the decisions that can be made from it
 */
public final class UserState {
    public enum Status {
        UNINITIALIZED,
        ACTIVE,
        SUSPENDED
    }

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public static final UserState UNINITIALIZED = new UserState(null, null, SubscriptionTier.FREE, Status.UNINITIALIZED);

    public final UserId           userId;
    public final String           email;
    public final SubscriptionTier tier;
    public final Status           status;

    UserState(UserId userId, String email, SubscriptionTier tier, Status status) {
        this.userId = userId;
        this.email = email;
        this.tier = tier;
        this.status = status;
    }

    UserState withTier(SubscriptionTier tier) {
        return new UserState(userId, email, tier, status);
    }

    UserState withStatus(Status status) {
        return new UserState(userId, email, tier, status);
    }

    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    /**
     * Trims and lower cases the email
     *
     * @throws ConstraintViolationException if the email isn't valid
     */
    public static String normalizeEmail(String email) {
        if (email == null) {
            throw new ConstraintViolationException("No email provided");
        }
        var normalized = email.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL_PATTERN.matcher(normalized).matches()) {
            throw new ConstraintViolationException(msg("'{}' isn't a valid email", email));
        }
        return normalized;
    }

    public List<UserEvent> register(UserId userId, String email, Instant now) {
        requireNonNull(userId, "No userId provided");
        if (status != Status.UNINITIALIZED) {
            throw new InvalidStateException(msg("User '{}' is already registered", userId));
        }
        return List.of(new UserEvent.UserCreated(userId, normalizeEmail(email), now));
    }

    public List<UserEvent> changeTier(SubscriptionTier newTier, Instant now) {
        requireNonNull(newTier, "No tier provided");
        requireRegistered();
        if (tier == newTier) {
            return List.of();
        }
        return List.of(new UserEvent.SubscriptionTierChanged(userId, newTier, now));
    }

    public List<UserEvent> suspend(String reason, Instant now) {
        requireRegistered();
        if (status == Status.SUSPENDED) {
            throw new InvalidStateException(msg("User '{}' is already suspended", userId));
        }
        return List.of(new UserEvent.UserSuspended(userId, reason, now));
    }

    public List<UserEvent> reactivate(Instant now) {
        requireRegistered();
        if (status != Status.SUSPENDED) {
            throw new InvalidStateException(msg("User '{}' isn't suspended", userId));
        }
        return List.of(new UserEvent.UserReactivated(userId, now));
    }

    /**
     * @throws InvalidStateException unless the user is registered and active
     */
    public void requireActive() {
        requireRegistered();
        if (status != Status.ACTIVE) {
            throw new InvalidStateException(msg("User '{}' is {}", userId, status));
        }
    }

    private void requireRegistered() {
        if (status == Status.UNINITIALIZED) {
            throw new InvalidStateException("User isn't registered");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserState)) return false;
        var that = (UserState) o;
        return Objects.equals(userId, that.userId) && Objects.equals(email, that.email) && tier == that.tier && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(userId, email, tier, status);
    }

    @Override
    public String toString() {
        return "UserState{" +
                "userId=" + userId +
                ", email='" + email + '\'' +
                ", tier=" + tier +
                ", status=" + status +
                '}';
    }
}
