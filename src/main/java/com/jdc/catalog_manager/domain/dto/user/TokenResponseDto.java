package com.jdc.catalog_manager.domain.dto.user;

public record TokenResponseDto(String accessToken, String tokenType, UserResponseDto user) {

    public static TokenResponseDto bearer(String accessToken, UserResponseDto user) {
        return new TokenResponseDto(accessToken, "bearer", user);
    }
}
