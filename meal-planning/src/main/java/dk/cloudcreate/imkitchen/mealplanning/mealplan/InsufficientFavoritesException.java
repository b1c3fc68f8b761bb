package dk.cloudcreate.imkitchen.mealplanning.mealplan;

import dk.cloudcreate.imkitchen.aggregates.ConstraintViolationException;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A meal plan can't be generated because the user has too few favorite recipes
 */
public class InsufficientFavoritesException extends ConstraintViolationException {
    public final int minimum;
    public final int current;

    public InsufficientFavoritesException(int minimum, int current) {
        super(msg("At least {} favorite recipes are required to generate a meal plan, but only {} were found", minimum, current));
        this.minimum = minimum;
        this.current = current;
    }
}
