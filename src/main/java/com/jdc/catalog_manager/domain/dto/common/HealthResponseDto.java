package com.jdc.catalog_manager.domain.dto.common;

public record HealthResponseDto(String status) {
}
