package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemResponseDto;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.entity.Storage;
import com.jdc.catalog_manager.domain.entity.StorageItem;

import java.math.BigDecimal;

public class StorageItemMapper {

    public static StorageItem toEntity(Storage storage, Material material, BigDecimal quantityValue) {
        return StorageItem.builder()
                .storage(storage)
                .material(material)
                .quantityValue(quantityValue)
                .build();
    }

    public static StorageItemResponseDto toDto(StorageItem entity) {
        Material material = entity.getMaterial();
        return StorageItemResponseDto.builder()
                .id(entity.getId())
                .storageId(entity.getStorage().getId())
                .materialId(material.getId())
                .materialName(material.getName())
                .categoryName(material.getCategory().getName())
                .unit(material.getUnit())
                .quantityValue(entity.getQuantityValue())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
