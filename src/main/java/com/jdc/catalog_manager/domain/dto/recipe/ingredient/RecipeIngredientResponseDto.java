package com.jdc.catalog_manager.domain.dto.recipe.ingredient;

import lombok.*;

import java.math.BigDecimal;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeIngredientResponseDto {
    private Long recipeItemId;
    private String ingredientName;
    private BigDecimal quantityValue;
    private String quantityUnit;
}
