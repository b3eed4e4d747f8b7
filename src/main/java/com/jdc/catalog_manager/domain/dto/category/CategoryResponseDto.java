package com.jdc.catalog_manager.domain.dto.category;

import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class CategoryResponseDto {
    private Long id;
    private String name;
    private LocalDateTime createdAt;
}
