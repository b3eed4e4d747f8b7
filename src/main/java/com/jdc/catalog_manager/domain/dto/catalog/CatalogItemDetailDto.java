package com.jdc.catalog_manager.domain.dto.catalog;

import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class CatalogItemDetailDto {
    private Long id;
    private String name;
    private LocalDateTime lastUsed;
}
