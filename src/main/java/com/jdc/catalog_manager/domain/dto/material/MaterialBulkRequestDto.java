package com.jdc.catalog_manager.domain.dto.material;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.util.List;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class MaterialBulkRequestDto {
    @NotEmpty
    @Size(max = 100)
    private List<@Valid MaterialRequestDto> materials;
}
