package dk.cloudcreate.imkitchen.mealplanning.recipe;

import dk.cloudcreate.imkitchen.aggregates.LimitExceededException;
import dk.cloudcreate.imkitchen.aggregates.command.*;
import dk.cloudcreate.imkitchen.eventstore.EventStore;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.mealplanning.user.*;
import org.jdbi.v3.core.Handle;
import org.slf4j.*;

import java.time.Clock;
import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The {@link CommandHandler}'s of the {@link Recipe} aggregate. They keep the {@link RecipeCommandIndex} in sync with the
 * recipe events in the same transaction
 */
public class RecipeCommandHandlers {
    private static final Logger log = LoggerFactory.getLogger(RecipeCommandHandlers.class);

    public static final String FREE_TIER_RECIPE_LIMIT = "recipes_per_free_user";

    private final EventStore                                                 eventStore;
    private final EventSourcedRepository<RecipeId, RecipeEvent, RecipeState> recipes;
    private final EventSourcedRepository<UserId, UserEvent, UserState>       users;
    private final Clock                                                      clock;

    public RecipeCommandHandlers(EventStore eventStore,
                                 EventSourcedRepository<RecipeId, RecipeEvent, RecipeState> recipes,
                                 EventSourcedRepository<UserId, UserEvent, UserState> users,
                                 Clock clock) {
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.recipes = requireNonNull(recipes, "No recipes repository provided");
        this.users = requireNonNull(users, "No users repository provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public static void createSideTables(Handle handle) {
        RecipeCommandIndex.createTable(handle);
    }

    public List<CommandHandler<?, ?>> handlers() {
        return List.of(new CreateRecipeHandler(),
                       new UpdateRecipeHandler(),
                       new FavoriteRecipeHandler(),
                       new ShareRecipeHandler(),
                       new DeleteRecipeHandler());
    }

    private Handle handle() {
        return eventStore.getUnitOfWorkFactory().getRequiredUnitOfWork().handle();
    }

    class CreateRecipeHandler implements CommandHandler<RecipeCommands.CreateRecipe, RecipeId> {
        @Override
        public Class<RecipeCommands.CreateRecipe> commandType() {
            return RecipeCommands.CreateRecipe.class;
        }

        @Override
        public RecipeId handle(RecipeCommands.CreateRecipe command) {
            var owner = users.load(command.ownerId).state;
            owner.requireActive();

            var handle = handle();
            RecipeCommandIndex.lockOwner(handle, command.ownerId);
            var maxRecipes = owner.tier.maxRecipes();
            if (maxRecipes.isPresent()) {
                var activeRecipes = RecipeCommandIndex.countActiveRecipes(handle, command.ownerId);
                if (activeRecipes >= maxRecipes.getAsInt()) {
                    throw new LimitExceededException(FREE_TIER_RECIPE_LIMIT,
                                                     maxRecipes.getAsInt(),
                                                     msg("User '{}' already has {} recipes, which is the maximum for the {} tier",
                                                         command.ownerId, activeRecipes, owner.tier));
                }
            }

            var recipe = recipes.loadOrInitial(command.recipeId);
            recipes.append(recipe, recipe.state.create(command, clock.instant()));
            RecipeCommandIndex.insert(handle, command.recipeId, command.ownerId, command.recipeType, command.advancePrepHours);
            log.debug("User '{}' created recipe '{}'", command.ownerId, command.recipeId);
            return command.recipeId;
        }
    }

    class UpdateRecipeHandler implements CommandHandler<RecipeCommands.UpdateRecipe, RecipeId> {
        @Override
        public Class<RecipeCommands.UpdateRecipe> commandType() {
            return RecipeCommands.UpdateRecipe.class;
        }

        @Override
        public RecipeId handle(RecipeCommands.UpdateRecipe command) {
            var recipe = recipes.load(command.recipeId);
            recipes.append(recipe, recipe.state.update(command, clock.instant()));
            RecipeCommandIndex.updateAdvancePrepHours(handle(), command.recipeId, command.advancePrepHours);
            return command.recipeId;
        }
    }

    class FavoriteRecipeHandler implements CommandHandler<RecipeCommands.FavoriteRecipe, RecipeId> {
        @Override
        public Class<RecipeCommands.FavoriteRecipe> commandType() {
            return RecipeCommands.FavoriteRecipe.class;
        }

        @Override
        public RecipeId handle(RecipeCommands.FavoriteRecipe command) {
            var recipe = recipes.load(command.recipeId);
            var events = recipe.state.favorite(command.requestedBy, command.favorited, clock.instant());
            if (!events.isEmpty()) {
                recipes.append(recipe, events);
                RecipeCommandIndex.setFavorited(handle(), command.recipeId, command.favorited);
            }
            return command.recipeId;
        }
    }

    class ShareRecipeHandler implements CommandHandler<RecipeCommands.ShareRecipe, RecipeId> {
        @Override
        public Class<RecipeCommands.ShareRecipe> commandType() {
            return RecipeCommands.ShareRecipe.class;
        }

        @Override
        public RecipeId handle(RecipeCommands.ShareRecipe command) {
            var recipe = recipes.load(command.recipeId);
            recipes.append(recipe, recipe.state.share(command.requestedBy, command.shared, clock.instant()));
            return command.recipeId;
        }
    }

    class DeleteRecipeHandler implements CommandHandler<RecipeCommands.DeleteRecipe, RecipeId> {
        @Override
        public Class<RecipeCommands.DeleteRecipe> commandType() {
            return RecipeCommands.DeleteRecipe.class;
        }

        @Override
        public RecipeId handle(RecipeCommands.DeleteRecipe command) {
            var recipe = recipes.load(command.recipeId);
            recipes.append(recipe, recipe.state.delete(command.requestedBy, clock.instant()));
            RecipeCommandIndex.markDeleted(handle(), command.recipeId);
            log.debug("Recipe '{}' deleted", command.recipeId);
            return command.recipeId;
        }
    }
}
