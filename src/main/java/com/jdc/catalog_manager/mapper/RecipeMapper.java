package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeResponseDto;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.jdc.catalog_manager.domain.entity.User;

public class RecipeMapper {

    public static Recipe toEntity(RecipeCreateRequestDto dto, User user) {
        return Recipe.builder()
                .user(user)
                .title(dto.getTitle())
                .externalUrl(blankToNull(dto.getExternalUrl()))
                .imageUrl(blankToNull(dto.getImageUrl()))
                .preparationSteps(dto.getPreparationSteps() != null ? dto.getPreparationSteps() : "")
                .prepTimeMinutes(dto.getPrepTimeMinutes() != null ? dto.getPrepTimeMinutes() : 0)
                .build();
    }

    public static RecipeResponseDto toDto(Recipe entity) {
        return RecipeResponseDto.builder()
                .id(entity.getId())
                .userId(entity.getUser().getId())
                .title(entity.getTitle())
                .externalUrl(entity.getExternalUrl())
                .imageUrl(entity.getImageUrl())
                .preparationSteps(entity.getPreparationSteps())
                .prepTimeMinutes(entity.getPrepTimeMinutes())
                .createdAt(entity.getCreatedAt())
                .build();
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
