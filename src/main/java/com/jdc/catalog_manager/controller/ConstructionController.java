package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionRequestDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionResponseDto;
import com.jdc.catalog_manager.domain.dto.construction.ConstructionUpdateRequestDto;
import com.jdc.catalog_manager.service.ConstructionService;
import com.jdc.catalog_manager.util.PageWindowResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/constructions")
@RequiredArgsConstructor
@Tag(name = "Constructions", description = "Construction sites")
public class ConstructionController {

    private static final String PATH = "/api/v1/constructions";

    private final ConstructionService constructionService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Create a construction")
    public ResponseEntity<ConstructionResponseDto> create(@RequestBody @Valid ConstructionRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(constructionService.create(dto));
    }

    @GetMapping
    @Operation(summary = "List constructions, newest first")
    public ResponseEntity<PageResponseDto<ConstructionResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = constructionService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All constructions without paging")
    public ResponseEntity<List<ConstructionResponseDto>> listPublic() {
        return ResponseEntity.ok(constructionService.listPublic());
    }

    @GetMapping("/search")
    @Operation(summary = "Search constructions by name and status")
    public ResponseEntity<PageResponseDto<ConstructionResponseDto>> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = constructionService.search(query, status, pageWindowResolver.resolve(limit, offset));
        Map<String, String> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("status", status);
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", params));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a construction")
    public ResponseEntity<ConstructionResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(constructionService.get(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a construction")
    public ResponseEntity<ConstructionResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid ConstructionUpdateRequestDto dto) {
        return ResponseEntity.ok(constructionService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a construction")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        constructionService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
