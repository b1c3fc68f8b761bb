package dk.cloudcreate.imkitchen.mealplanning.shopping;

import java.util.*;

/**
 * Grocery store section of an ingredient, in the order a shopping list is sorted by
 */
public enum IngredientCategory {
    PRODUCE("tomato", "tomatoes", "onion", "onions", "garlic", "lettuce", "carrot", "carrots", "celery", "bell pepper", "bell peppers",
            "cucumber", "zucchini", "broccoli", "cauliflower", "spinach", "kale", "cabbage", "potato", "potatoes", "sweet potato",
            "mushroom", "mushrooms", "green beans", "peas", "corn", "avocado", "eggplant", "squash", "ginger", "cilantro", "parsley",
            "basil", "mint", "thyme", "rosemary", "apple", "apples", "banana", "bananas", "orange", "oranges", "lemon", "lemons",
            "lime", "limes", "strawberries", "blueberries", "raspberries", "grapes", "mango", "pineapple"),
    DAIRY("milk", "cream", "heavy cream", "sour cream", "butter", "cheese", "cheddar", "mozzarella", "parmesan", "feta",
          "cream cheese", "yogurt", "greek yogurt", "ricotta", "egg", "eggs"),
    MEAT("chicken", "chicken breast", "chicken thighs", "turkey", "duck", "beef", "ground beef", "steak", "brisket", "pork", "bacon",
         "ham", "sausage", "sausages", "fish", "salmon", "tuna", "cod", "shrimp", "prawns", "lamb", "veal"),
    PANTRY("flour", "rice", "pasta", "spaghetti", "penne", "oats", "quinoa", "couscous", "sugar", "brown sugar", "baking powder",
           "baking soda", "yeast", "vanilla extract", "cocoa powder", "olive oil", "vegetable oil", "oil", "vinegar", "soy sauce",
           "ketchup", "mustard", "mayonnaise", "salt", "pepper", "black pepper", "paprika", "cumin", "cinnamon", "oregano",
           "tomato paste", "tomato sauce", "canned tomatoes", "broth", "stock", "beans", "chickpeas", "honey", "peanut butter",
           "almonds", "walnuts", "cashews"),
    FROZEN("frozen vegetables", "frozen peas", "frozen berries", "ice cream", "frozen pizza"),
    BAKERY("bread", "baguette", "sourdough", "tortillas", "pita", "bagels", "croissants", "buns", "rolls"),
    OTHER;

    private final Set<String> keywords;

    IngredientCategory(String... keywords) {
        this.keywords = Set.of(keywords);
    }

    /**
     * Categorize an ingredient by name: an exact keyword match wins, then the first category with a keyword that appears as
     * a word of the name (so "chicken thigh fillets" is {@link #MEAT}). Anything else is {@link #OTHER}
     */
    public static IngredientCategory categorize(String ingredientName) {
        if (ingredientName == null) {
            return OTHER;
        }
        var normalized = normalize(ingredientName);
        if (normalized.startsWith("frozen ")) {
            return FROZEN;
        }
        for (var category : values()) {
            if (category.keywords.contains(normalized)) {
                return category;
            }
        }
        var words = Arrays.asList(normalized.split(" "));
        for (var category : values()) {
            for (var keyword : category.keywords) {
                if (!keyword.contains(" ") && words.contains(keyword)) {
                    return category;
                }
            }
        }
        return OTHER;
    }

    static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
