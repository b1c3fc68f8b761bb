package dk.cloudcreate.imkitchen.mealplanning.user;

import dk.cloudcreate.imkitchen.aggregates.command.*;
import dk.cloudcreate.imkitchen.eventstore.EventStore;
import dk.cloudcreate.imkitchen.mealplanning.types.UserId;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.Clock;
import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The {@link CommandHandler}'s of the {@link User} aggregate
 */
public class UserCommandHandlers {
    private static final Logger log = LoggerFactory.getLogger(UserCommandHandlers.class);

    /**
     * Uniqueness side table guarding that an email is only registered once
     */
    public static final String USER_EMAIL_UNIQUENESS = "user_email_uniqueness";

    private final EventStore                                           eventStore;
    private final EventSourcedRepository<UserId, UserEvent, UserState> users;
    private final Clock                                                clock;

    public UserCommandHandlers(EventStore eventStore, EventSourcedRepository<UserId, UserEvent, UserState> users, Clock clock) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.users = requireNonNull(users, "No users repository provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public static void createSideTables(Handle handle) {
        UniquenessConstraints.createConstraintTable(handle, USER_EMAIL_UNIQUENESS);
    }

    public List<CommandHandler<?, ?>> handlers() {
        return List.of(new RegisterUserHandler(),
                       new ChangeSubscriptionTierHandler(),
                       new SuspendUserHandler(),
                       new ReactivateUserHandler());
    }

    private Handle handle() {
        return eventStore.getUnitOfWorkFactory().getRequiredUnitOfWork().handle();
    }

    class RegisterUserHandler implements CommandHandler<UserCommands.RegisterUser, UserId> {
        @Override
        public Class<UserCommands.RegisterUser> commandType() {
            return UserCommands.RegisterUser.class;
        }

        @Override
        public UserId handle(UserCommands.RegisterUser command) {
            var user   = users.loadOrInitial(command.userId);
            var events = user.state.register(command.userId, command.email, clock.instant());
            var email  = ((UserEvent.UserCreated) events.get(0)).email;
            UniquenessConstraints.claim(handle(), USER_EMAIL_UNIQUENESS, email, command.userId, clock);
            users.append(user, events);
            log.debug("Registered user '{}'", command.userId);
            return command.userId;
        }
    }

    class ChangeSubscriptionTierHandler implements CommandHandler<UserCommands.ChangeSubscriptionTier, UserId> {
        @Override
        public Class<UserCommands.ChangeSubscriptionTier> commandType() {
            return UserCommands.ChangeSubscriptionTier.class;
        }

        @Override
        public UserId handle(UserCommands.ChangeSubscriptionTier command) {
            var user = users.load(command.userId);
            users.append(user, user.state.changeTier(command.tier, clock.instant()));
            return command.userId;
        }
    }

    class SuspendUserHandler implements CommandHandler<UserCommands.SuspendUser, UserId> {
        @Override
        public Class<UserCommands.SuspendUser> commandType() {
            return UserCommands.SuspendUser.class;
        }

        @Override
        public UserId handle(UserCommands.SuspendUser command) {
            var user = users.load(command.userId);
            users.append(user, user.state.suspend(command.reason, clock.instant()));
            return command.userId;
        }
    }

    class ReactivateUserHandler implements CommandHandler<UserCommands.ReactivateUser, UserId> {
        @Override
        public Class<UserCommands.ReactivateUser> commandType() {
            return UserCommands.ReactivateUser.class;
        }

        @Override
        public UserId handle(UserCommands.ReactivateUser command) {
            var user = users.load(command.userId);
            users.append(user, user.state.reactivate(clock.instant()));
            return command.userId;
        }
    }
}
