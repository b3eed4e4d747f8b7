package com.jdc.catalog_manager.domain.dto.material;

import com.jdc.catalog_manager.domain.type.MaterialUnit;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class MaterialRequestDto {
    @NotNull
    private Long categoryId;

    @NotBlank
    @Size(max = 100)
    private String name;

    private String description;

    private MaterialUnit unit;
}
