package com.jdc.catalog_manager.domain.dto.storage;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class StorageRequestDto {
    @NotNull
    private Long constructionId;

    @NotBlank
    @Size(max = 100)
    private String name;
}
