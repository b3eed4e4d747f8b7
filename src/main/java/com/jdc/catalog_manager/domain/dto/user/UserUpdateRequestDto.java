package com.jdc.catalog_manager.domain.dto.user;

import com.jdc.catalog_manager.domain.type.Role;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.*;

/**
 * Partial update; {@code null} fields are left unchanged. Only an admin may change {@code role}.
 */
@Getter @Setter
@NoArgsConstructor @AllArgsConstructor
@Builder
public class UserUpdateRequestDto {
    @Email
    @Size(max = 255)
    private String email;

    private Role role;
}
