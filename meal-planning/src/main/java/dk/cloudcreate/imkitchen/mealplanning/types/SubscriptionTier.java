package dk.cloudcreate.imkitchen.mealplanning.types;

import java.util.OptionalInt;

public enum SubscriptionTier {
    FREE(10),
    PREMIUM(-1);

    private final int maxRecipes;

    SubscriptionTier(int maxRecipes) {
        this.maxRecipes = maxRecipes;
    }

    /**
     * @return the maximum number of (non deleted) recipes a user on this tier may own, or empty if unlimited
     */
    public OptionalInt maxRecipes() {
        return maxRecipes < 0 ? OptionalInt.empty() : OptionalInt.of(maxRecipes);
    }
}
