package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.aggregates.*;
import dk.cloudcreate.imkitchen.mealplanning.types.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable state of a {@link MealPlan} together with the decisions that can be made from it
 */
public final class MealPlanState {
    public enum Status {
        UNINITIALIZED,
        ACTIVE,
        ARCHIVED
    }

    public static final int MINIMUM_FAVORITES = 7;
    public static final int MAXIMUM_WEEKS     = 5;

    public static final MealPlanState UNINITIALIZED = new MealPlanState(null, null, null, List.of(), Status.UNINITIALIZED);

    public final MealPlanId     mealPlanId;
    public final UserId         userId;
    public final LocalDate      startDate;
    public final List<WeekPlan> weeks;
    public final Status         status;

    MealPlanState(MealPlanId mealPlanId, UserId userId, LocalDate startDate, List<WeekPlan> weeks, Status status) {
        this.mealPlanId = mealPlanId;
        this.userId = userId;
        this.startDate = startDate;
        this.weeks = List.copyOf(weeks);
        this.status = status;
    }

    public Optional<MealAssignment> findAssignment(LocalDate date, CourseType courseType) {
        return weeks.stream()
                    .flatMap(week -> week.assignments.stream())
                    .filter(assignment -> assignment.isFor(date, courseType))
                    .findFirst();
    }

    public Optional<WeekPlan> week(int weekNumber) {
        return weeks.stream().filter(week -> week.weekNumber == weekNumber).findFirst();
    }

    /**
     * @param candidates the user's favorite recipes
     * @throws InsufficientFavoritesException if fewer than {@link #MINIMUM_FAVORITES} candidates are provided
     */
    public List<MealPlanEvent> generate(MealPlanId mealPlanId,
                                        UserId userId,
                                        LocalDate startDate,
                                        int weeks,
                                        List<MealCandidate> candidates,
                                        Instant now) {
        requireNonNull(mealPlanId, "No mealPlanId provided");
        requireNonNull(userId, "No userId provided");
        requireNonNull(candidates, "No candidates provided");
        if (status != Status.UNINITIALIZED) {
            throw new InvalidStateException(msg("Meal plan '{}' has already been generated", this.mealPlanId));
        }
        if (startDate == null || startDate.getDayOfWeek() != DayOfWeek.MONDAY) {
            throw new ConstraintViolationException(msg("A meal plan must start on a Monday, not {}", startDate));
        }
        if (weeks < 1 || weeks > MAXIMUM_WEEKS) {
            throw new ConstraintViolationException(msg("A meal plan must span 1 to {} weeks, not {}", MAXIMUM_WEEKS, weeks));
        }
        if (candidates.size() < MINIMUM_FAVORITES) {
            throw new InsufficientFavoritesException(MINIMUM_FAVORITES, candidates.size());
        }
        var weekPlans = MealAssignmentAlgorithm.assign(startDate, weeks, candidates);
        return List.of(new MealPlanEvent.MealPlanGenerated(mealPlanId, userId, startDate, weekPlans, now));
    }

    /**
     * @param replacement a favorite recipe of the plan's user
     */
    public List<MealPlanEvent> replaceMeal(UserId requestedBy, LocalDate date, CourseType courseType, MealCandidate replacement, Instant now) {
        requireNonNull(replacement, "No replacement provided");
        requireModifiableBy(requestedBy, "replace a meal in");
        var assignment = findAssignment(date, courseType)
                .orElseThrow(() -> new ConstraintViolationException(msg("Meal plan '{}' has no {} on {}", mealPlanId, courseType, date)));
        if (assignment.recipeId.equals(replacement.recipeId)) {
            return List.of();
        }
        return List.of(new MealPlanEvent.MealReplaced(mealPlanId,
                                                      userId,
                                                      date,
                                                      courseType,
                                                      assignment.recipeId,
                                                      replacement.recipeId,
                                                      replacement.prepRequired(),
                                                      now));
    }

    public List<MealPlanEvent> archive(UserId requestedBy, Instant now) {
        requireModifiableBy(requestedBy, "archive");
        return List.of(new MealPlanEvent.MealPlanArchived(mealPlanId, userId, now));
    }

    /**
     * @throws InvalidStateException        unless the meal plan is active
     * @throws ConstraintViolationException unless <code>requestedBy</code> owns the meal plan
     */
    public void requireModifiableBy(UserId requestedBy, String action) {
        if (status == Status.UNINITIALIZED) {
            throw new InvalidStateException(msg("Cannot {} a meal plan that hasn't been generated", action));
        }
        if (status == Status.ARCHIVED) {
            throw new InvalidStateException(msg("Cannot {} archived meal plan '{}'", action, mealPlanId));
        }
        if (!userId.equals(requestedBy)) {
            throw new ConstraintViolationException(msg("Only the owner of meal plan '{}' can {} it", mealPlanId, action));
        }
    }

    MealPlanState withReplacedMeal(LocalDate date, CourseType courseType, RecipeId recipeId, boolean prepRequired) {
        var updatedWeeks = weeks.stream()
                                .map(week -> new WeekPlan(week.weekNumber,
                                                          week.weekStartDate,
                                                          week.assignments.stream()
                                                                          .map(assignment -> assignment.isFor(date, courseType) ?
                                                                                             assignment.withRecipe(recipeId, prepRequired, MealAssignment.REPLACED_BY_USER) :
                                                                                             assignment)
                                                                          .collect(Collectors.toList())))
                                .collect(Collectors.toList());
        return new MealPlanState(mealPlanId, userId, startDate, updatedWeeks, status);
    }

    MealPlanState asArchived() {
        return new MealPlanState(mealPlanId, userId, startDate, weeks, Status.ARCHIVED);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MealPlanState)) return false;
        var that = (MealPlanState) o;
        return Objects.equals(mealPlanId, that.mealPlanId) &&
                Objects.equals(userId, that.userId) &&
                Objects.equals(startDate, that.startDate) &&
                Objects.equals(weeks, that.weeks) &&
                status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mealPlanId, userId, startDate, weeks, status);
    }

    @Override
    public String toString() {
        return "MealPlanState{" +
                "mealPlanId=" + mealPlanId +
                ", userId=" + userId +
                ", startDate=" + startDate +
                ", weeks=" + weeks.size() +
                ", status=" + status +
                '}';
    }
}
