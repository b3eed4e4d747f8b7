package com.jdc.catalog_manager.domain.dto.recipe;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class RecipeUpdateRequestDto {

    @Size(min = 1, max = 255)
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String title;

    @Size(max = 2048)
    @Pattern(regexp = "^$|^https?://.*", message = "must start with http:// or https://")
    private String externalUrl;

    @Size(max = 500)
    private String imageUrl;

    private String preparationSteps;

    @Min(0)
    private Integer prepTimeMinutes;
}
