package dk.cloudcreate.imkitchen.mealplanning.types;

/**
 * The course a recipe is served as. Every day of a meal plan has one slot per course, in declaration order
 */
public enum CourseType {
    APPETIZER("appetizer"),
    MAIN_COURSE("main course"),
    DESSERT("dessert");

    private final String displayName;

    CourseType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
