package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.time.LocalDate;
import java.util.*;

public final class WeekPlan {
    /**
     * 1 based
     */
    public final int                  weekNumber;
    public final LocalDate            weekStartDate;
    public final List<MealAssignment> assignments;

    @JsonCreator
    public WeekPlan(int weekNumber, LocalDate weekStartDate, List<MealAssignment> assignments) {
        this.weekNumber = weekNumber;
        this.weekStartDate = weekStartDate;
        this.assignments = assignments != null ? List.copyOf(assignments) : List.of();
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(weekStartDate) && date.isBefore(weekStartDate.plusDays(7));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeekPlan)) return false;
        var that = (WeekPlan) o;
        return weekNumber == that.weekNumber && Objects.equals(weekStartDate, that.weekStartDate) && Objects.equals(assignments, that.assignments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weekNumber, weekStartDate, assignments);
    }

    @Override
    public String toString() {
        return "WeekPlan{" +
                "weekNumber=" + weekNumber +
                ", weekStartDate=" + weekStartDate +
                ", assignments=" + assignments.size() +
                '}';
    }
}
