package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.mealplanning.types.CourseType;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Assigns favorite recipes to every course of every day of a meal plan.<br>
 * The candidates are ordered by recipe id and each course rotates through the candidates of its own type; a course without
 * candidates of its type rotates through all candidates. The same input therefore always yields the same plan.
 */
public final class MealAssignmentAlgorithm {
    public static final int DAYS_PER_WEEK = 7;

    private MealAssignmentAlgorithm() {
    }

    public static List<WeekPlan> assign(LocalDate startDate, int weeks, List<MealCandidate> candidates) {
        requireNonNull(startDate, "No startDate provided");
        requireTrue(weeks > 0, "weeks must be > 0");
        requireNonNull(candidates, "No candidates provided");
        requireTrue(!candidates.isEmpty(), "No candidates provided");

        var sortedCandidates = candidates.stream()
                                         .sorted(Comparator.comparing(candidate -> candidate.recipeId.toString()))
                                         .collect(Collectors.toList());
        var rotations = new EnumMap<CourseType, Rotation>(CourseType.class);
        for (var courseType : CourseType.values()) {
            rotations.put(courseType, new Rotation(courseType, sortedCandidates));
        }

        var weekPlans = new ArrayList<WeekPlan>(weeks);
        for (int week = 0; week < weeks; week++) {
            var weekStartDate = startDate.plusWeeks(week);
            var assignments   = new ArrayList<MealAssignment>(DAYS_PER_WEEK * CourseType.values().length);
            for (int day = 0; day < DAYS_PER_WEEK; day++) {
                var date = weekStartDate.plusDays(day);
                for (var courseType : CourseType.values()) {
                    assignments.add(rotations.get(courseType).next(date));
                }
            }
            weekPlans.add(new WeekPlan(week + 1, weekStartDate, assignments));
        }
        return weekPlans;
    }

    private static class Rotation {
        private final CourseType          courseType;
        private final List<MealCandidate> pool;
        private final boolean             fallback;
        private       int                 position;

        Rotation(CourseType courseType, List<MealCandidate> candidates) {
            this.courseType = courseType;
            var matching = candidates.stream()
                                     .filter(candidate -> candidate.recipeType == courseType)
                                     .collect(Collectors.toList());
            this.fallback = matching.isEmpty();
            this.pool = fallback ? candidates : matching;
        }

        MealAssignment next(LocalDate date) {
            var index     = position % pool.size();
            var candidate = pool.get(index);
            position++;
            var reasoning = fallback ?
                            msg("No favorite {} recipes, using favorite {} of {}", courseType.displayName(), index + 1, pool.size()) :
                            msg("Favorite {} {} of {} in rotation", courseType.displayName(), index + 1, pool.size());
            if (candidate.prepRequired()) {
                reasoning += msg(", needs {} hours of advance prep", candidate.advancePrepHours);
            }
            return new MealAssignment(date, courseType, candidate.recipeId, candidate.prepRequired(), reasoning);
        }
    }
}
