package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.HealthResponseDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health check", description = "Liveness check")
public class HealthCheckController {

    @GetMapping("/api/v1/health")
    @Operation(summary = "Health check", description = "Always answers {\"status\": \"healthy\"} while the server is up.")
    public HealthResponseDto health() {
        return new HealthResponseDto("healthy");
    }
}
