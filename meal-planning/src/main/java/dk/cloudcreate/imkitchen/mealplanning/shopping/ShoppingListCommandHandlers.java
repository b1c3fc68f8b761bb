package dk.cloudcreate.imkitchen.mealplanning.shopping;

import dk.cloudcreate.imkitchen.aggregates.ConstraintViolationException;
import dk.cloudcreate.imkitchen.aggregates.command.*;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.slf4j.*;

import java.time.Clock;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The {@link CommandHandler}'s of the {@link ShoppingList} aggregate. The ingredients come from the recipe aggregates in the
 * event store, never from a read model, so a shopping list always reflects the committed recipes
 */
public class ShoppingListCommandHandlers {
    private static final Logger log = LoggerFactory.getLogger(ShoppingListCommandHandlers.class);

    private final EventSourcedRepository<ShoppingListId, ShoppingListEvent, ShoppingListState> shoppingLists;
    private final EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState>             mealPlans;
    private final EventSourcedRepository<RecipeId, RecipeEvent, RecipeState>                   recipes;
    private final Clock                                                                        clock;

    public ShoppingListCommandHandlers(EventSourcedRepository<ShoppingListId, ShoppingListEvent, ShoppingListState> shoppingLists,
                                       EventSourcedRepository<MealPlanId, MealPlanEvent, MealPlanState> mealPlans,
                                       EventSourcedRepository<RecipeId, RecipeEvent, RecipeState> recipes,
                                       Clock clock) {
        this.shoppingLists = requireNonNull(shoppingLists, "No shoppingLists repository provided");
        this.mealPlans = requireNonNull(mealPlans, "No mealPlans repository provided");
        this.recipes = requireNonNull(recipes, "No recipes repository provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public List<CommandHandler<?, ?>> handlers() {
        return List.of(new GenerateShoppingListHandler(),
                       new CollectShoppingListItemHandler());
    }

    class GenerateShoppingListHandler implements CommandHandler<ShoppingListCommands.GenerateShoppingList, ShoppingListId> {
        @Override
        public Class<ShoppingListCommands.GenerateShoppingList> commandType() {
            return ShoppingListCommands.GenerateShoppingList.class;
        }

        @Override
        public ShoppingListId handle(ShoppingListCommands.GenerateShoppingList command) {
            var mealPlan = mealPlans.load(command.mealPlanId).state;
            mealPlan.requireModifiableBy(mealPlan.userId, "generate a shopping list for");
            var week = mealPlan.week(command.weekNumber)
                               .orElseThrow(() -> new ConstraintViolationException(msg("Meal plan '{}' has no week {}", command.mealPlanId, command.weekNumber)));

            var recipeStates = new HashMap<RecipeId, RecipeState>();
            var ingredients  = new ArrayList<Ingredient>();
            for (var assignment : week.assignments) {
                var recipe = recipeStates.computeIfAbsent(assignment.recipeId, recipeId -> recipes.load(recipeId).state);
                ingredients.addAll(recipe.ingredients);
            }
            var items = ShoppingListAggregator.aggregate(ingredients);

            var shoppingList = shoppingLists.loadOrInitial(command.shoppingListId);
            shoppingLists.append(shoppingList, shoppingList.state.generate(command.shoppingListId,
                                                                           mealPlan.userId,
                                                                           command.mealPlanId,
                                                                           week.weekStartDate,
                                                                           items,
                                                                           clock.instant()));
            log.debug("Generated shopping list '{}' with {} item(s) for week {} of meal plan '{}'",
                      command.shoppingListId, items.size(), command.weekNumber, command.mealPlanId);
            return command.shoppingListId;
        }
    }

    class CollectShoppingListItemHandler implements CommandHandler<ShoppingListCommands.CollectShoppingListItem, ShoppingListId> {
        @Override
        public Class<ShoppingListCommands.CollectShoppingListItem> commandType() {
            return ShoppingListCommands.CollectShoppingListItem.class;
        }

        @Override
        public ShoppingListId handle(ShoppingListCommands.CollectShoppingListItem command) {
            var shoppingList = shoppingLists.load(command.shoppingListId);
            shoppingLists.append(shoppingList, shoppingList.state.collect(command.itemIndex, command.collected, clock.instant()));
            return command.shoppingListId;
        }
    }
}
