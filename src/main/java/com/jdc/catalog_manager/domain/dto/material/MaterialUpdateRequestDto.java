package com.jdc.catalog_manager.domain.dto.material;

import com.jdc.catalog_manager.domain.type.MaterialUnit;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class MaterialUpdateRequestDto {
    private Long categoryId;

    @Size(min = 1, max = 100)
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String name;

    private String description;

    private MaterialUnit unit;
}
