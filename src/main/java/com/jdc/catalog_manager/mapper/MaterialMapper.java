package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.material.MaterialRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialResponseDto;
import com.jdc.catalog_manager.domain.entity.Category;
import com.jdc.catalog_manager.domain.entity.Material;
import com.jdc.catalog_manager.domain.type.MaterialUnit;

public class MaterialMapper {

    public static Material toEntity(MaterialRequestDto dto, Category category) {
        return Material.builder()
                .category(category)
                .name(dto.getName().strip())
                .description(dto.getDescription() != null ? dto.getDescription().strip() : "")
                .unit(dto.getUnit() != null ? dto.getUnit() : MaterialUnit.OTHER)
                .build();
    }

    public static MaterialResponseDto toDto(Material entity) {
        Category category = entity.getCategory();
        return MaterialResponseDto.builder()
                .id(entity.getId())
                .categoryId(category.getId())
                .categoryName(category.getName())
                .name(entity.getName())
                .description(entity.getDescription())
                .unit(entity.getUnit())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
