package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.aggregates.LimitExceededException;
import dk.cloudcreate.imkitchen.aggregates.command.UniquenessViolationException;
import dk.cloudcreate.imkitchen.eventstore.types.GlobalEventOrder;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.readmodel.*;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.shopping.ShoppingListCommands;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import dk.cloudcreate.imkitchen.mealplanning.user.UserCommands;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class MealPlanningScenarioTest {
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("meal-planning")
            .withUsername("test-user")
            .withPassword("secret-password");

    private MealPlanningCore      core;
    private ProjectionTestHarness harness;

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                               postgreSQLContainer.getUsername(),
                               postgreSQLContainer.getPassword());
        core = new MealPlanningCore(jdbi, MealPlanningConfiguration.defaultConfiguration()
                                                                   .withClock(Clock.fixed(Instant.parse("2025-01-03T08:00:00Z"), ZoneOffset.UTC))
                                                                   .withContinuousProjections(false));
        core.start();
        harness = new ProjectionTestHarness(core);
    }

    @AfterEach
    void cleanup() {
        if (core != null) {
            core.stop();
        }
    }

    @Test
    void registering_a_user_creates_one_users_row() {
        UserId userId = harness.execute(new UserCommands.RegisterUser("Alice@Example.com"));

        assertThat(harness.countRows(UserProjection.USERS)).isEqualTo(1);
        var email = harness.read(handle -> handle.createQuery("SELECT email FROM users WHERE id = :id")
                                                 .bind("id", userId.toString())
                                                 .mapTo(String.class)
                                                 .one());
        assertThat(email).isEqualTo("alice@example.com");
    }

    @Test
    void an_email_can_only_be_registered_once() {
        harness.execute(new UserCommands.RegisterUser("alice@example.com"));
        var secondUserId = UserId.random();

        assertThatThrownBy(() -> harness.execute(new UserCommands.RegisterUser(secondUserId, "ALICE@example.com")))
                .isExactlyInstanceOf(UniquenessViolationException.class);
        assertThat(core.eventStore().fetchStream(dk.cloudcreate.imkitchen.mealplanning.user.User.USERS, secondUserId)).isEmpty();
        assertThat(harness.countRows(UserProjection.USERS)).isEqualTo(1);
    }

    @Test
    void generating_a_meal_plan_without_favorites_appends_no_events() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 10);
        var mealPlanId = MealPlanId.random();

        assertThatThrownBy(() -> harness.execute(new MealPlanCommands.GenerateMealPlan(mealPlanId, userId, MONDAY, 1)))
                .isExactlyInstanceOf(InsufficientFavoritesException.class)
                .satisfies(e -> {
                    assertThat(((InsufficientFavoritesException) e).minimum).isEqualTo(7);
                    assertThat(((InsufficientFavoritesException) e).current).isEqualTo(0);
                });

        assertThat(recipes).hasSize(10);
        assertThat(core.eventStore().fetchStream(MealPlan.MEAL_PLANS, mealPlanId)).isEmpty();
        harness.drain();
        assertThat(harness.countRows(MealPlanProjection.MEAL_PLANS)).isZero();
        assertThat(harness.countRows(RecipeListProjection.RECIPE_LIST, "user_id = ?", userId.toString())).isEqualTo(10);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 3})
    void a_meal_plan_assigns_three_courses_for_every_day(int weeks) {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 10);
        favorite(userId, recipes.subList(0, 7));

        MealPlanId mealPlanId = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, weeks));

        assertThat(harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS, "user_id = ?", userId.toString())).isEqualTo(7 * 3 * weeks);
        assertThat(harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS, "meal_plan_id = ? AND recipe_id NOT IN (" + inList(recipes.subList(0, 7)) + ")",
                                     mealPlanId.toString()))
                .isZero();
        var endDate = harness.read(handle -> handle.createQuery("SELECT end_date FROM meal_plans WHERE id = :id")
                                                   .bind("id", mealPlanId.toString())
                                                   .mapTo(LocalDate.class)
                                                   .one());
        assertThat(endDate).isEqualTo(MONDAY.plusWeeks(weeks).minusDays(1));
    }

    @Test
    void generating_a_new_meal_plan_archives_the_active_one() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 7);
        favorite(userId, recipes);
        MealPlanId firstPlan = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, 2));

        MealPlanId secondPlan = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY.plusWeeks(1), 1));

        assertThat(harness.countRows(MealPlanProjection.MEAL_PLANS, "id = ? AND status = 'ARCHIVED' AND archived_at IS NOT NULL", firstPlan.toString()))
                .isEqualTo(1);
        assertThat(harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS, "user_id = ?", userId.toString())).isEqualTo(21);
        assertThat(harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS, "meal_plan_id = ?", secondPlan.toString())).isEqualTo(21);
        assertThat(activeMealPlanOnDashboard(userId)).isEqualTo(secondPlan.toString());
        assertThatThrownBy(() -> harness.execute(new MealPlanCommands.ArchiveMealPlan(firstPlan, userId)))
                .isExactlyInstanceOf(dk.cloudcreate.imkitchen.aggregates.InvalidStateException.class);
    }

    @Test
    void replacing_a_meal_updates_the_calendar() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 8);
        favorite(userId, recipes);
        MealPlanId mealPlanId = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, 1));
        var date = MONDAY.plusDays(3);
        var current = harness.read(handle -> handle.createQuery("SELECT recipe_id FROM meal_assignments WHERE id = :id")
                                                   .bind("id", MealPlanProjection.assignmentId(mealPlanId, date, CourseType.DESSERT))
                                                   .mapTo(String.class)
                                                   .one());
        var replacement = recipes.stream().filter(recipeId -> !recipeId.toString().equals(current)).findFirst().orElseThrow();

        harness.execute(new MealPlanCommands.ReplaceMeal(mealPlanId, userId, date, CourseType.DESSERT, replacement));

        var row = harness.read(handle -> handle.createQuery("SELECT recipe_id, assignment_reasoning FROM meal_assignments WHERE id = :id")
                                               .bind("id", MealPlanProjection.assignmentId(mealPlanId, date, CourseType.DESSERT))
                                               .map((rs, ctx) -> List.of(rs.getString("recipe_id"), rs.getString("assignment_reasoning")))
                                               .one());
        assertThat(row).containsExactly(replacement.toString(), MealAssignment.REPLACED_BY_USER);
        assertThatThrownBy(() -> harness.execute(new MealPlanCommands.ReplaceMeal(mealPlanId, userId, date, CourseType.DESSERT, RecipeId.random())))
                .isExactlyInstanceOf(dk.cloudcreate.imkitchen.aggregates.ConstraintViolationException.class);
    }

    @Test
    void a_free_user_can_own_at_most_ten_recipes() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 10);

        assertThatThrownBy(() -> harness.execute(createRecipe(userId, 11)))
                .isExactlyInstanceOf(LimitExceededException.class)
                .satisfies(e -> assertThat(((LimitExceededException) e).limit).isEqualTo(10));

        harness.execute(new RecipeCommands.DeleteRecipe(recipes.get(0), userId));
        harness.execute(createRecipe(userId, 12));
        harness.execute(new UserCommands.ChangeSubscriptionTier(userId, SubscriptionTier.PREMIUM));
        harness.execute(createRecipe(userId, 13));

        assertThat(harness.countRows(RecipeListProjection.RECIPE_LIST, "user_id = ? AND deleted_at IS NULL", userId.toString())).isEqualTo(11);
        assertThat(harness.countRows(UserProjection.USERS, "id = ? AND tier = 'PREMIUM'", userId.toString())).isEqualTo(1);
        assertThat(recipeCountOnDashboard(userId)).isEqualTo(11);
    }

    @Test
    void the_dashboard_counts_recipes_and_favorites() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 5);
        favorite(userId, recipes.subList(0, 3));
        harness.execute(new RecipeCommands.DeleteRecipe(recipes.get(0), userId));
        harness.execute(new RecipeCommands.FavoriteRecipe(recipes.get(1), userId, false));

        var counts = harness.read(handle -> handle.createQuery("SELECT recipe_count, favorite_count FROM dashboard_metrics WHERE user_id = :userId")
                                                  .bind("userId", userId.toString())
                                                  .map((rs, ctx) -> List.of(rs.getInt("recipe_count"), rs.getInt("favorite_count")))
                                                  .one());
        assertThat(counts).containsExactly(4, 1);
    }

    @Test
    void a_shopping_list_aggregates_the_ingredients_of_the_week() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 7);
        favorite(userId, recipes);
        MealPlanId mealPlanId = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, 1));

        ShoppingListId shoppingListId = harness.execute(new ShoppingListCommands.GenerateShoppingList(mealPlanId, 1));

        // Every recipe uses flour and its own spice, so flour is summed across all 21 meals
        assertThat(harness.countRows(ShoppingListProjection.SHOPPING_LIST_VIEW, "shopping_list_id = ?", shoppingListId.toString())).isEqualTo(8);
        var flour = harness.read(handle -> handle.createQuery("SELECT quantity FROM shopping_list_view WHERE shopping_list_id = :id AND ingredient_name = 'flour'")
                                                 .bind("id", shoppingListId.toString())
                                                 .mapTo(java.math.BigDecimal.class)
                                                 .one());
        assertThat(flour).isEqualByComparingTo("2100");

        harness.execute(new ShoppingListCommands.CollectShoppingListItem(shoppingListId, 0, true));
        harness.execute(new ShoppingListCommands.CollectShoppingListItem(shoppingListId, 0, true));
        assertThat(harness.countRows(ShoppingListProjection.SHOPPING_LIST_SUMMARY, "shopping_list_id = ? AND total_items = 8 AND collected_items = 1",
                                     shoppingListId.toString()))
                .isEqualTo(1);
        assertThatThrownBy(() -> harness.execute(new ShoppingListCommands.GenerateShoppingList(mealPlanId, 2)))
                .isExactlyInstanceOf(dk.cloudcreate.imkitchen.aggregates.ConstraintViolationException.class);
    }

    @Test
    void rebuilding_a_projection_restores_the_same_rows() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 7);
        favorite(userId, recipes);
        harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, 2));
        var before = harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS);

        var replayed = core.projectionRunner().rebuild(MealPlanProjection.NAME);

        assertThat(replayed).isEqualTo(1);
        assertThat(harness.countRows(MealPlanProjection.MEAL_ASSIGNMENTS)).isEqualTo(before).isEqualTo(42);
        assertThat(harness.drain().totalAppliedEvents()).isZero();
    }

    @Test
    void redelivering_every_event_leaves_the_read_models_unchanged() {
        var userId  = registerUser();
        var recipes = createRecipes(userId, 8);
        favorite(userId, recipes);
        harness.execute(new RecipeCommands.DeleteRecipe(recipes.get(7), userId));
        MealPlanId mealPlanId = harness.execute(new MealPlanCommands.GenerateMealPlan(userId, MONDAY, 1));
        ShoppingListId shoppingListId = harness.execute(new ShoppingListCommands.GenerateShoppingList(mealPlanId, 1));
        harness.execute(new ShoppingListCommands.CollectShoppingListItem(shoppingListId, 2, true));
        var tables = List.of(UserProjection.USERS,
                             RecipeListProjection.RECIPE_LIST,
                             RecipeListProjection.RECIPE_INGREDIENTS,
                             MealPlanProjection.MEAL_PLANS,
                             MealPlanProjection.MEAL_ASSIGNMENTS,
                             DashboardProjection.DASHBOARD_RECIPE_FLAGS,
                             DashboardProjection.DASHBOARD_METRICS,
                             ShoppingListProjection.SHOPPING_LIST_VIEW,
                             ShoppingListProjection.SHOPPING_LIST_SUMMARY);
        var before = snapshotOf(tables);

        core.unitOfWorkFactory().usingUnitOfWork(unitOfWork -> {
            for (var handler : core.projectionRegistry().handlers()) {
                for (var aggregateType : handler.aggregateTypes()) {
                    core.eventStore()
                        .loadEventsAfterGlobalOrder(aggregateType, GlobalEventOrder.NONE, 1000)
                        .stream()
                        .filter(event -> handler.interestedEventTypes().contains(event.eventType()))
                        .forEach(event -> handler.apply(unitOfWork, event));
                }
            }
        });

        assertThat(snapshotOf(tables)).isEqualTo(before);
    }

    private Map<String, List<Map<String, Object>>> snapshotOf(List<String> tables) {
        var snapshot = new LinkedHashMap<String, List<Map<String, Object>>>();
        tables.forEach(table -> snapshot.put(table, harness.read(handle -> handle.createQuery("SELECT * FROM " + table + " ORDER BY 1, 2")
                                                                                 .mapToMap()
                                                                                 .list())));
        return snapshot;
    }

    private UserId registerUser() {
        return harness.execute(new UserCommands.RegisterUser(UUID.randomUUID() + "@example.com"));
    }

    private List<RecipeId> createRecipes(UserId owner, int count) {
        var recipes = new ArrayList<RecipeId>();
        for (var i = 1; i <= count; i++) {
            RecipeId recipeId = harness.execute(createRecipe(owner, i));
            recipes.add(recipeId);
        }
        return recipes;
    }

    private static RecipeCommands.CreateRecipe createRecipe(UserId owner, int number) {
        var courseType = CourseType.values()[number % CourseType.values().length];
        return new RecipeCommands.CreateRecipe(RecipeId.random(),
                                               owner,
                                               "Recipe " + number,
                                               courseType,
                                               List.of(Ingredient.of("Flour", "100", "g"), Ingredient.of("Spice " + number, "1", "tsp")),
                                               List.of(InstructionStep.of(1, "Cook it")),
                                               10,
                                               20,
                                               number % 4 == 0 ? 8 : 0,
                                               2);
    }

    private void favorite(UserId owner, List<RecipeId> recipes) {
        recipes.forEach(recipeId -> harness.execute(new RecipeCommands.FavoriteRecipe(recipeId, owner, true)));
    }

    private String activeMealPlanOnDashboard(UserId userId) {
        return harness.read(handle -> handle.createQuery("SELECT active_meal_plan_id FROM dashboard_metrics WHERE user_id = :userId")
                                            .bind("userId", userId.toString())
                                            .mapTo(String.class)
                                            .one());
    }

    private int recipeCountOnDashboard(UserId userId) {
        return harness.read(handle -> handle.createQuery("SELECT recipe_count FROM dashboard_metrics WHERE user_id = :userId")
                                            .bind("userId", userId.toString())
                                            .mapTo(Integer.class)
                                            .one());
    }

    private static String inList(List<RecipeId> recipes) {
        var joiner = new StringJoiner(", ");
        recipes.forEach(recipeId -> joiner.add("'" + recipeId + "'"));
        return joiner.toString();
    }
}
