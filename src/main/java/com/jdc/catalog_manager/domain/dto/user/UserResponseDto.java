package com.jdc.catalog_manager.domain.dto.user;

import com.jdc.catalog_manager.domain.type.Role;
import lombok.*;

import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UserResponseDto {
    private Long id;
    private String email;
    private Role role;
    private LocalDateTime createdAt;
}
