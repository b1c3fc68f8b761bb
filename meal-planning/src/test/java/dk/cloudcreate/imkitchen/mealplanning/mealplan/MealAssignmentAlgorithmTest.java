package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.mealplanning.types.*;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class MealAssignmentAlgorithmTest {
    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);

    static List<MealCandidate> favorites() {
        return List.of(new MealCandidate(RecipeId.of("recipe-1"), CourseType.APPETIZER, 0),
                       new MealCandidate(RecipeId.of("recipe-2"), CourseType.APPETIZER, 0),
                       new MealCandidate(RecipeId.of("recipe-3"), CourseType.APPETIZER, 0),
                       new MealCandidate(RecipeId.of("recipe-4"), CourseType.MAIN_COURSE, 4),
                       new MealCandidate(RecipeId.of("recipe-5"), CourseType.MAIN_COURSE, 0),
                       new MealCandidate(RecipeId.of("recipe-6"), CourseType.DESSERT, 0),
                       new MealCandidate(RecipeId.of("recipe-7"), CourseType.DESSERT, 0));
    }

    @Test
    void every_course_of_every_day_is_assigned() {
        var weeks = MealAssignmentAlgorithm.assign(MONDAY, 3, favorites());

        assertThat(weeks).hasSize(3);
        assertThat(weeks).extracting(week -> week.weekNumber).containsExactly(1, 2, 3);
        assertThat(weeks).extracting(week -> week.weekStartDate).containsExactly(MONDAY, MONDAY.plusWeeks(1), MONDAY.plusWeeks(2));
        weeks.forEach(week -> {
            assertThat(week.assignments).hasSize(21);
            assertThat(week.assignments).allSatisfy(assignment -> assertThat(week.contains(assignment.date)).isTrue());
        });
    }

    @Test
    void each_course_rotates_through_the_favorites_of_its_type() {
        var assignments = MealAssignmentAlgorithm.assign(MONDAY, 1, favorites()).get(0).assignments;

        assertThat(recipesFor(assignments, CourseType.APPETIZER))
                .containsExactly("recipe-1", "recipe-2", "recipe-3", "recipe-1", "recipe-2", "recipe-3", "recipe-1");
        assertThat(recipesFor(assignments, CourseType.MAIN_COURSE))
                .containsExactly("recipe-4", "recipe-5", "recipe-4", "recipe-5", "recipe-4", "recipe-5", "recipe-4");
        var firstMain = assignments.stream().filter(assignment -> assignment.isFor(MONDAY, CourseType.MAIN_COURSE)).findFirst().orElseThrow();
        assertThat(firstMain.prepRequired).isTrue();
        assertThat(firstMain.reasoning).isEqualTo("Favorite main course 1 of 2 in rotation, needs 4 hours of advance prep");
    }

    @Test
    void the_same_favorites_in_any_order_yield_the_same_plan() {
        var shuffled = new ArrayList<>(favorites());
        Collections.shuffle(shuffled, new Random(42));

        assertThat(MealAssignmentAlgorithm.assign(MONDAY, 2, shuffled))
                .isEqualTo(MealAssignmentAlgorithm.assign(MONDAY, 2, favorites()));
    }

    @Test
    void a_course_without_favorites_of_its_type_falls_back_to_any_favorite() {
        var mainsOnly = favorites().stream()
                                   .map(candidate -> new MealCandidate(candidate.recipeId, CourseType.MAIN_COURSE, 0))
                                   .collect(Collectors.toList());

        var assignments = MealAssignmentAlgorithm.assign(MONDAY, 1, mainsOnly).get(0).assignments;

        assertThat(recipesFor(assignments, CourseType.DESSERT)).hasSize(7).doesNotHaveDuplicates();
        var firstDessert = assignments.stream().filter(assignment -> assignment.isFor(MONDAY, CourseType.DESSERT)).findFirst().orElseThrow();
        assertThat(firstDessert.reasoning).isEqualTo("No favorite dessert recipes, using favorite 1 of 7");
    }

    private static List<String> recipesFor(List<MealAssignment> assignments, CourseType courseType) {
        return assignments.stream()
                          .filter(assignment -> assignment.courseType == courseType)
                          .map(assignment -> assignment.recipeId.toString())
                          .collect(Collectors.toList());
    }
}
