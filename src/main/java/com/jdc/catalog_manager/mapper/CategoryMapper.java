package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.category.CategoryResponseDto;
import com.jdc.catalog_manager.domain.entity.Category;

public class CategoryMapper {

    public static Category toEntity(String name) {
        return Category.builder()
                .name(name.strip())
                .build();
    }

    public static CategoryResponseDto toDto(Category entity) {
        return CategoryResponseDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
