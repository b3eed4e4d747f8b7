package com.jdc.catalog_manager.domain.dto.storage;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class StorageUpdateRequestDto {
    private Long constructionId;

    @Size(min = 1, max = 100)
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String name;
}
