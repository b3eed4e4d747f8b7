package com.jdc.catalog_manager.domain.dto.storage.item;

import com.jdc.catalog_manager.domain.type.MaterialUnit;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class StorageItemResponseDto {
    private Long id;
    private Long storageId;
    private Long materialId;
    private String materialName;
    private String categoryName;
    private MaterialUnit unit;
    private BigDecimal quantityValue;
    private LocalDateTime createdAt;
}
