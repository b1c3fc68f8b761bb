package dk.cloudcreate.imkitchen.mealplanning.shopping;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IngredientCategoryTest {
    @Test
    void an_exact_keyword_match_wins() {
        assertThat(IngredientCategory.categorize("Bell Pepper")).isEqualTo(IngredientCategory.PRODUCE);
        assertThat(IngredientCategory.categorize("ice cream")).isEqualTo(IngredientCategory.FROZEN);
        assertThat(IngredientCategory.categorize("Olive Oil")).isEqualTo(IngredientCategory.PANTRY);
    }

    @Test
    void a_keyword_word_inside_the_name_categorizes_it() {
        assertThat(IngredientCategory.categorize("chicken thigh fillets")).isEqualTo(IngredientCategory.MEAT);
        assertThat(IngredientCategory.categorize("  Whole   Milk ")).isEqualTo(IngredientCategory.DAIRY);
        assertThat(IngredientCategory.categorize("sourdough bread")).isEqualTo(IngredientCategory.BAKERY);
    }

    @Test
    void frozen_items_are_frozen_whatever_they_are() {
        assertThat(IngredientCategory.categorize("Frozen spinach")).isEqualTo(IngredientCategory.FROZEN);
    }

    @Test
    void unknown_ingredients_are_other() {
        assertThat(IngredientCategory.categorize("saffron")).isEqualTo(IngredientCategory.OTHER);
        assertThat(IngredientCategory.categorize(null)).isEqualTo(IngredientCategory.OTHER);
    }
}
