package com.jdc.catalog_manager.domain.dto.construction;

import com.jdc.catalog_manager.domain.type.ConstructionStatus;
import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ConstructionResponseDto {
    private Long id;
    private String name;
    private String description;
    private String address;
    private LocalDateTime startDate;
    private ConstructionStatus status;
    private String imgUrl;
    private LocalDateTime createdAt;
}
