package dk.cloudcreate.imkitchen.mealplanning;

import dk.cloudcreate.imkitchen.eventstore.serializer.JacksonJSONSerializer;
import dk.cloudcreate.imkitchen.mealplanning.mealplan.*;
import dk.cloudcreate.imkitchen.mealplanning.recipe.*;
import dk.cloudcreate.imkitchen.mealplanning.shopping.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The events with nested value objects must survive the trip through the event store's JSON columns
 */
class EventSerializationTest {
    private static final Instant   NOW    = Instant.parse("2025-01-03T08:00:00Z");
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    private final JacksonJSONSerializer serializer = new JacksonJSONSerializer();

    @Test
    void a_generated_meal_plan_keeps_its_assignments() {
        var mealPlan = new MealPlan();
        var event = new MealPlanEvent.MealPlanGenerated(MealPlanId.random(),
                                                        UserId.random(),
                                                        MONDAY,
                                                        MealAssignmentAlgorithm.assign(MONDAY, 2, List.of(new MealCandidate(RecipeId.of("a"), CourseType.APPETIZER, 0),
                                                                                                          new MealCandidate(RecipeId.of("b"), CourseType.MAIN_COURSE, 24),
                                                                                                          new MealCandidate(RecipeId.of("c"), CourseType.DESSERT, 0))),
                                                        NOW);

        var json         = serializer.serialize(event);
        var deserialized = serializer.deserialize(json, MealPlanEvent.MealPlanGenerated.class);

        assertThat(json).contains("\"recipeId\":\"b\"").contains("\"startDate\":\"2025-01-06\"");
        assertThat(deserialized.weeks).isEqualTo(event.weeks);
        assertThat(mealPlan.rehydrate(List.of(deserialized))).isEqualTo(mealPlan.rehydrate(List.of(event)));
    }

    @Test
    void a_created_recipe_keeps_its_ingredients_and_instructions() {
        var event = new RecipeEvent.RecipeCreated(RecipeId.random(),
                                                  UserId.random(),
                                                  "Soup",
                                                  CourseType.APPETIZER,
                                                  List.of(Ingredient.of("Onion", "1.5", null), Ingredient.of("Stock", "1", "l")),
                                                  List.of(new InstructionStep(1, "Simmer", 20)),
                                                  5,
                                                  30,
                                                  0,
                                                  4,
                                                  NOW);

        var deserialized = serializer.deserialize(serializer.serialize(event), RecipeEvent.RecipeCreated.class);

        assertThat(deserialized.ingredients).isEqualTo(event.ingredients);
        assertThat(deserialized.instructions).isEqualTo(event.instructions);
        assertThat(deserialized.createdAt).isEqualTo(NOW);
        assertThat((CharSequence) deserialized.ownerId).isEqualTo(event.ownerId);
    }

    @Test
    void a_generated_shopping_list_keeps_its_items() {
        var event = new ShoppingListEvent.ShoppingListGenerated(ShoppingListId.random(),
                                                                UserId.random(),
                                                                MealPlanId.random(),
                                                                MONDAY,
                                                                List.of(new ShoppingListItem("milk", new BigDecimal("1.25"), "l", IngredientCategory.DAIRY)),
                                                                NOW);

        var deserialized = serializer.deserialize(serializer.serialize(event), ShoppingListEvent.ShoppingListGenerated.class);

        assertThat(deserialized.items).isEqualTo(event.items);
        assertThat(deserialized.weekStartDate).isEqualTo(MONDAY);
    }
}
