package com.jdc.catalog_manager.domain.dto.category;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class CategoryRequestDto {
    @NotBlank
    @Size(max = 100)
    private String name;
}
