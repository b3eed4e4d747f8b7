package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.construction.ConstructionRequestDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionResponseDto;
import com.jdc.catalog_manager.domain.entity.Construction;
import com.jdc.catalog_manager.domain.type.ConstructionStatus;

public class ConstructionMapper {

    public static Construction toEntity(ConstructionRequestDto dto) {
        return Construction.builder()
                .name(dto.getName().strip())
                .description(dto.getDescription() != null ? dto.getDescription().strip() : "")
                .address(dto.getAddress() != null ? dto.getAddress().strip() : "")
                .startDate(dto.getStartDate())
                .status(dto.getStatus() != null ? dto.getStatus() : ConstructionStatus.INACTIVE)
                .imgUrl(dto.getImgUrl() != null && !dto.getImgUrl().isBlank() ? dto.getImgUrl().strip() : null)
                .build();
    }

    public static ConstructionResponseDto toDto(Construction entity) {
        return ConstructionResponseDto.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .address(entity.getAddress())
                .startDate(entity.getStartDate())
                .status(entity.getStatus())
                .imgUrl(entity.getImgUrl())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
