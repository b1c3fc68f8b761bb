package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MealPlanStateTest {
    private static final Instant   NOW    = Instant.parse("2025-01-03T08:00:00Z");
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    private final MealPlan   mealPlan   = new MealPlan();
    private final MealPlanId mealPlanId = MealPlanId.random();
    private final UserId     owner      = UserId.random();

    private MealPlanState active;

    @BeforeEach
    void setup() {
        active = mealPlan.rehydrate(MealPlanState.UNINITIALIZED.generate(mealPlanId, owner, MONDAY, 2, MealAssignmentAlgorithmTest.favorites(), NOW));
    }

    @Test
    void generating_needs_at_least_seven_favorites() {
        var sixFavorites = MealAssignmentAlgorithmTest.favorites().subList(0, 6);

        assertThatThrownBy(() -> MealPlanState.UNINITIALIZED.generate(mealPlanId, owner, MONDAY, 1, sixFavorites, NOW))
                .isExactlyInstanceOf(InsufficientFavoritesException.class)
                .satisfies(e -> {
                    var insufficientFavorites = (InsufficientFavoritesException) e;
                    assertThat(insufficientFavorites.minimum).isEqualTo(7);
                    assertThat(insufficientFavorites.current).isEqualTo(6);
                });
    }

    @Test
    void a_meal_plan_starts_on_a_monday_and_spans_one_to_five_weeks() {
        var favorites = MealAssignmentAlgorithmTest.favorites();

        assertThatThrownBy(() -> MealPlanState.UNINITIALIZED.generate(mealPlanId, owner, MONDAY.plusDays(1), 1, favorites, NOW))
                .isExactlyInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> MealPlanState.UNINITIALIZED.generate(mealPlanId, owner, MONDAY, 6, favorites, NOW))
                .isExactlyInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> MealPlanState.UNINITIALIZED.generate(mealPlanId, owner, MONDAY, 0, favorites, NOW))
                .isExactlyInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void a_generated_plan_has_the_weeks_and_cannot_be_generated_again() {
        assertThat(active.status).isEqualTo(MealPlanState.Status.ACTIVE);
        assertThat(active.weeks).hasSize(2);
        assertThat(active.week(2)).isPresent();
        assertThat(active.week(3)).isEmpty();
        assertThatThrownBy(() -> active.generate(mealPlanId, owner, MONDAY, 1, MealAssignmentAlgorithmTest.favorites(), NOW))
                .isExactlyInstanceOf(InvalidStateException.class);
    }

    @Test
    void replacing_a_meal_updates_the_assignment() {
        var date        = MONDAY.plusDays(2);
        var replacement = new MealCandidate(RecipeId.of("recipe-9"), CourseType.MAIN_COURSE, 12);

        var events   = active.replaceMeal(owner, date, CourseType.MAIN_COURSE, replacement, NOW);
        var replaced = mealPlan.apply(active, events.get(0));

        var assignment = replaced.findAssignment(date, CourseType.MAIN_COURSE).orElseThrow();
        assertThat((CharSequence) assignment.recipeId).isEqualTo(RecipeId.of("recipe-9"));
        assertThat(assignment.prepRequired).isTrue();
        assertThat(assignment.reasoning).isEqualTo(MealAssignment.REPLACED_BY_USER);
        assertThat(replaced.replaceMeal(owner, date, CourseType.MAIN_COURSE, replacement, NOW)).isEmpty();
    }

    @Test
    void replacing_a_meal_outside_the_plan_is_a_constraint_violation() {
        var replacement = new MealCandidate(RecipeId.of("recipe-9"), CourseType.MAIN_COURSE, 0);

        assertThatThrownBy(() -> active.replaceMeal(owner, MONDAY.plusWeeks(2), CourseType.MAIN_COURSE, replacement, NOW))
                .isExactlyInstanceOf(ConstraintViolationException.class);
        assertThatThrownBy(() -> active.replaceMeal(UserId.random(), MONDAY, CourseType.MAIN_COURSE, replacement, NOW))
                .isExactlyInstanceOf(ConstraintViolationException.class);
    }

    @Test
    void an_archived_plan_rejects_every_command() {
        var archived    = mealPlan.apply(active, active.archive(owner, NOW).get(0));
        var replacement = new MealCandidate(RecipeId.of("recipe-9"), CourseType.MAIN_COURSE, 0);

        assertThat(archived.status).isEqualTo(MealPlanState.Status.ARCHIVED);
        assertThatThrownBy(() -> archived.archive(owner, NOW)).isExactlyInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> archived.replaceMeal(owner, MONDAY, CourseType.MAIN_COURSE, replacement, NOW))
                .isExactlyInstanceOf(InvalidStateException.class);
    }

    @Test
    void rehydrating_the_same_events_yields_the_same_state() {
        var events = List.<MealPlanEvent>of(new MealPlanEvent.MealPlanGenerated(mealPlanId, owner, MONDAY,
                                                                                 MealAssignmentAlgorithm.assign(MONDAY, 1, MealAssignmentAlgorithmTest.favorites()),
                                                                                 NOW),
                                            new MealPlanEvent.MealReplaced(mealPlanId, owner, MONDAY, CourseType.DESSERT,
                                                                           RecipeId.of("recipe-6"), RecipeId.of("recipe-7"), false, NOW));

        assertThat(mealPlan.rehydrate(events)).isEqualTo(mealPlan.rehydrate(events));
        assertThat(mealPlan.rehydrate(events).findAssignment(MONDAY, CourseType.DESSERT).orElseThrow().recipeId.toString())
                .isEqualTo("recipe-7");
    }
}
