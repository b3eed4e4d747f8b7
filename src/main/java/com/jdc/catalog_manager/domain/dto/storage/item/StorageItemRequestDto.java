package com.jdc.catalog_manager.domain.dto.storage.item;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.math.BigDecimal;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class StorageItemRequestDto {
    @NotNull
    private Long storageId;

    @NotNull
    private Long materialId;

    @NotNull
    @DecimalMin("0")
    @Digits(integer = 10, fraction = 2)
    private BigDecimal quantityValue;
}
