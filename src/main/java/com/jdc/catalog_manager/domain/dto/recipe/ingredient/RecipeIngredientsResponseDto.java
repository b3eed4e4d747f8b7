package com.jdc.catalog_manager.domain.dto.recipe.ingredient;

import java.util.List;

public record RecipeIngredientsResponseDto(
        Long recipeId,
        List<RecipeIngredientResponseDto> ingredients,
        int total
) {
    public static RecipeIngredientsResponseDto of(Long recipeId, List<RecipeIngredientResponseDto> ingredients) {
        return new RecipeIngredientsResponseDto(recipeId, ingredients, ingredients.size());
    }
}
