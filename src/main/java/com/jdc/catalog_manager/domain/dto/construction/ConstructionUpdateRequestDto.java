package com.jdc.catalog_manager.domain.dto.construction;

import com.jdc.catalog_manager.domain.type.ConstructionStatus;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class ConstructionUpdateRequestDto {
    @Size(min = 1, max = 100)
    @Pattern(regexp = ".*\\S.*", message = "must not be blank")
    private String name;

    private String description;

    @Size(max = 255)
    private String address;

    private LocalDateTime startDate;

    private ConstructionStatus status;

    @Size(max = 500)
    private String imgUrl;
}
