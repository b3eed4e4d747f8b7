package com.jdc.catalog_manager.domain.dto.catalog;

import lombok.*;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class CatalogItemResponseDto {
    private Long id;
    private String name;
}
