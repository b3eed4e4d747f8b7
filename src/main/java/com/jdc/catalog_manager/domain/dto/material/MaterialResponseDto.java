package com.jdc.catalog_manager.domain.dto.material;

import com.jdc.catalog_manager.domain.type.MaterialUnit;
import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class MaterialResponseDto {
    private Long id;
    private Long categoryId;
    private String categoryName;
    private String name;
    private String description;
    private MaterialUnit unit;
    private LocalDateTime createdAt;
}
