package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemDetailDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemResponseDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;

public class CatalogItemMapper {

    public static CatalogItem toEntity(String name) {
        return CatalogItem.builder()
                .name(name)
                .build();
    }

    public static CatalogItemResponseDto toDto(CatalogItem entity) {
        return CatalogItemResponseDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .build();
    }

    public static CatalogItemDetailDto toDetailDto(CatalogItem entity) {
        return CatalogItemDetailDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .lastUsed(entity.getLastUsed())
                .build();
    }
}
