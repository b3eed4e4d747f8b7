package com.jdc.catalog_manager.domain.dto.storage;

import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class StorageResponseDto {
    private Long id;
    private Long constructionId;
    private String constructionName;
    private String name;
    private LocalDateTime createdAt;
}
