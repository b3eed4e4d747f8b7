package com.jdc.catalog_manager.domain.dto.recipe;

import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeResponseDto {
    private Long id;
    private Long userId;
    private String title;
    private String externalUrl;
    private String imageUrl;
    private String preparationSteps;
    private Integer prepTimeMinutes;
    private LocalDateTime createdAt;
}
