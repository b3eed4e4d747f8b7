package com.jdc.catalog_manager.domain.dto.recipe.ingredient;

import lombok.*;

import java.math.BigDecimal;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeIngredientRequestDto {
    private String name;
    private BigDecimal quantityValue;
    private String quantityUnit;
}
