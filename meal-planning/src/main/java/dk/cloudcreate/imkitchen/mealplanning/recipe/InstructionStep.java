package dk.cloudcreate.imkitchen.mealplanning.recipe;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Objects;

public final class InstructionStep {
    public final int     stepNumber;
    public final String  text;
    /**
     * Optional timer for the step
     */
    public final Integer timerMinutes;

    @JsonCreator
    public InstructionStep(int stepNumber, String text, Integer timerMinutes) {
        this.stepNumber = stepNumber;
        this.text = text;
        this.timerMinutes = timerMinutes;
    }

    public static InstructionStep of(int stepNumber, String text) {
        return new InstructionStep(stepNumber, text, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstructionStep)) return false;
        var that = (InstructionStep) o;
        return stepNumber == that.stepNumber && Objects.equals(text, that.text) && Objects.equals(timerMinutes, that.timerMinutes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepNumber, text, timerMinutes);
    }

    @Override
    public String toString() {
        return stepNumber + ". " + text;
    }
}
