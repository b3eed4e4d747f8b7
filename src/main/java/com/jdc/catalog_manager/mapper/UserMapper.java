package com.jdc.catalog_manager.mapper;

import com.jdc.catalog_manager.domain.dto.user.UserResponseDto;
import com.jdc.catalog_manager.domain.entity.User;

public class UserMapper {

    public static User toEntity(String email, String passwordHash) {
        return User.builder()
                .email(email)
                .passwordHash(passwordHash)
                .build();
    }

    public static UserResponseDto toDto(User user) {
        return UserResponseDto.builder()
                .id(user.getId())
                .email(user.getEmail())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
