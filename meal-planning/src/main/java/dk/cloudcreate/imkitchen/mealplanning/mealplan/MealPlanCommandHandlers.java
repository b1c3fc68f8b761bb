package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.aggregates.ConstraintViolationException;
import dk.cloudcreate.imkitchen.aggregates.command.*;
import dk.cloudcreate.imkitchen.eventstore.EventStore;
import dk.cloudcreate.imkitchen.mealplanning.recipe.RecipeCommandIndex;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.mealplanning.user.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The {@link CommandHandler}'s of the {@link MealPlan} aggregate. Favorites are read from the {@link RecipeCommandIndex} and
 * the active meal plan of each user is tracked in {@link ActiveMealPlans}
 */
public class MealPlanCommandHandlers {
    private static final Logger log = LoggerFactory.getLogger(MealPlanCommandHandlers.class);

    private final EventStore                                                       eventStore;
    private final EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState> mealPlans;
    private final EventSourcedRepository<UserId, UserEvent, UserState>             users;
    private final Clock                                                            clock;

    public MealPlanCommandHandlers(EventStore eventStore,
                                   EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState> mealPlans,
                                   EventSourcedRepository<UserId, UserEvent, UserState> users,
                                   Clock clock) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.mealPlans = requireNonNull(mealPlans, "No mealPlans repository provided");
        this.users = requireNonNull(users, "No users repository provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public static void createSideTables(Handle handle) {
        ActiveMealPlans.createTable(handle);
    }

    public List<CommandHandler<?, ?>> handlers() {
        return List.of(new GenerateMealPlanHandler(),
                       new ReplaceMealHandler(),
                       new ArchiveMealPlanHandler());
    }

    private Handle handle() {
        return eventStore.getUnitOfWorkFactory().getRequiredUnitOfWork().handle();
    }

    private static List<MealCandidate> favoritesOf(Handle handle, UserId userId) {
        return RecipeCommandIndex.favoritesOf(handle, userId)
                                 .stream()
                                 .map(recipe -> new MealCandidate(recipe.recipeId, recipe.recipeType, recipe.advancePrepHours))
                                 .collect(Collectors.toList());
    }

    class GenerateMealPlanHandler implements CommandHandler<MealPlanCommands.GenerateMealPlan, MealPlanId> {
        @Override
        public Class<MealPlanCommands.GenerateMealPlan> commandType() {
            return MealPlanCommands.GenerateMealPlan.class;
        }

        @Override
        public MealPlanId handle(MealPlanCommands.GenerateMealPlan command) {
            users.load(command.userId).state.requireActive();

            var handle = handle();
            ActiveMealPlans.lockUser(handle, command.userId);
            var now      = clock.instant();
            var mealPlan = mealPlans.loadOrInitial(command.mealPlanId);
            var events = mealPlan.state.generate(command.mealPlanId,
                                                 command.userId,
                                                 command.startDate,
                                                 command.weeks,
                                                 favoritesOf(handle, command.userId),
                                                 now);

            var previousMealPlanId = ActiveMealPlans.find(handle, command.userId);
            if (previousMealPlanId.isPresent()) {
                var previousMealPlan = mealPlans.load(previousMealPlanId.get());
                mealPlans.append(previousMealPlan, previousMealPlan.state.archive(command.userId, now));
                log.debug("User '{}' generated a new meal plan, archived meal plan '{}'", command.userId, previousMealPlanId.get());
            }
            mealPlans.append(mealPlan, events);
            ActiveMealPlans.activate(handle, command.userId, command.mealPlanId);
            log.debug("Generated {} week meal plan '{}' for user '{}'", command.weeks, command.mealPlanId, command.userId);
            return command.mealPlanId;
        }
    }

    class ReplaceMealHandler implements CommandHandler<MealPlanCommands.ReplaceMeal, MealPlanId> {
        @Override
        public Class<MealPlanCommands.ReplaceMeal> commandType() {
            return MealPlanCommands.ReplaceMeal.class;
        }

        @Override
        public MealPlanId handle(MealPlanCommands.ReplaceMeal command) {
            var mealPlan = mealPlans.load(command.mealPlanId);
            mealPlan.state.requireModifiableBy(command.requestedBy, "replace a meal in");
            var replacement = favoritesOf(handle(), mealPlan.state.userId)
                    .stream()
                    .filter(candidate -> candidate.recipeId.equals(command.newRecipeId))
                    .findFirst()
                    .orElseThrow(() -> new ConstraintViolationException(msg("Recipe '{}' isn't one of the user's favorite recipes", command.newRecipeId)));
            mealPlans.append(mealPlan, mealPlan.state.replaceMeal(command.requestedBy, command.date, command.courseType, replacement, clock.instant()));
            return command.mealPlanId;
        }
    }

    class ArchiveMealPlanHandler implements CommandHandler<MealPlanCommands.ArchiveMealPlan, MealPlanId> {
        @Override
        public Class<MealPlanCommands.ArchiveMealPlan> commandType() {
            return MealPlanCommands.ArchiveMealPlan.class;
        }

        @Override
        public MealPlanId handle(MealPlanCommands.ArchiveMealPlan command) {
            var mealPlan = mealPlans.load(command.mealPlanId);
            mealPlans.append(mealPlan, mealPlan.state.archive(command.requestedBy, clock.instant()));
            ActiveMealPlans.deactivate(handle(), mealPlan.state.userId, command.mealPlanId);
            return command.mealPlanId;
        }
    }
}
