package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.storage.StorageRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageResponseDto;
import com.jdc.catalog_manager.domain.entity.Construction;
import com.jdc.catalog_manager.domain.entity.Storage;

public class StorageMapper {

    public static Storage toEntity(StorageRequestDto dto, Construction construction) {
        return Storage.builder()
                .construction(construction)
                .name(dto.getName().strip())
                .build();
    }

    public static StorageResponseDto toDto(Storage entity) {
        Construction construction = entity.getConstruction();
        return StorageResponseDto.builder()
                .id(entity.getId())
                .constructionId(construction.getId())
                .constructionName(construction.getName())
                .name(entity.getName())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
