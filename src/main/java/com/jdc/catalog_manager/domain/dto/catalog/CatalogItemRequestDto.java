package com.jdc.catalog_manager.domain.dto.catalog;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class CatalogItemRequestDto {
    @NotBlank
    @Size(max = 100)
    private String name;
}
