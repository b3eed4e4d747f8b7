package com.jdc.catalog_manager.domain.dto.construction;

import com.jdc.catalog_manager.domain.type.ConstructionStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ConstructionRequestDto {
    @NotBlank
    @Size(max = 100)
    private String name;

    private String description;

    @Size(max = 255)
    private String address;

    private LocalDateTime startDate;

    private ConstructionStatus status;

    @Size(max = 500)
    private String imgUrl;
}
