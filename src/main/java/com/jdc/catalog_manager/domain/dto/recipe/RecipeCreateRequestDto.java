package com.jdc.catalog_manager.domain.dto.recipe;

import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of recipe creation. Checked as a whole by {@code RecipeRequestValidator}
 * so that every offending field is reported at once.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeCreateRequestDto {
    private String title;
    private String externalUrl;
    private String imageUrl;
    private String preparationSteps;
    private Integer prepTimeMinutes;

    @Builder.Default
    private List<RecipeIngredientRequestDto> ingredients = new ArrayList<>();
}
