package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientResponseDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.entity.Quantity;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.jdc.catalog_manager.domain.entity.RecipeItem;

public class RecipeItemMapper {

    public static RecipeItem toEntity(Recipe recipe, CatalogItem item, Quantity quantity) {
        return RecipeItem.builder()
                .recipe(recipe)
                .catalogItem(item)
                .quantity(quantity)
                .build();
    }

    public static RecipeIngredientResponseDto toDto(RecipeItem entity) {
        return RecipeIngredientResponseDto.builder()
                .recipeItemId(entity.getId())
                .ingredientName(entity.getCatalogItem().getName())
                .quantityValue(entity.getQuantity().getValue())
                .quantityUnit(entity.getQuantity().getUnit())
                .build();
    }
}
