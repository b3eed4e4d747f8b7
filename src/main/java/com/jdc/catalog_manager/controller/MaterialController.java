package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialRequestDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialResponseDto;
import com.jdc.catalog_manager.domain.dto.material.MaterialUpdateRequestDto;
import com.jdc.catalog_manager.service.MaterialService;
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
@RequestMapping("/api/v1/materials")
@RequiredArgsConstructor
@Tag(name = "Materials", description = "Construction materials")
public class MaterialController {

    private static final String PATH = "/api/v1/materials";

    private final MaterialService materialService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Create a material")
    public ResponseEntity<MaterialResponseDto> create(@RequestBody @Valid MaterialRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(materialService.create(dto));
    }

    @PostMapping("/bulk")
    @Operation(summary = "Create several materials at once", description = "All or nothing.")
    public ResponseEntity<List<MaterialResponseDto>> createBulk(@RequestBody @Valid MaterialBulkRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(materialService.createBulk(dto));
    }

    @GetMapping
    @Operation(summary = "List materials, newest first")
    public ResponseEntity<PageResponseDto<MaterialResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = materialService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All materials without paging")
    public ResponseEntity<List<MaterialResponseDto>> listPublic() {
        return ResponseEntity.ok(materialService.listPublic());
    }

    @GetMapping("/category/{categoryId}")
    @Operation(summary = "Materials of one category")
    public ResponseEntity<PageResponseDto<MaterialResponseDto>> listByCategory(
            @PathVariable Long categoryId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = materialService.listByCategory(categoryId, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/category/" + categoryId, Map.of()));
    }

    @GetMapping("/search")
    @Operation(summary = "Search materials by name, optionally inside one category")
    public ResponseEntity<PageResponseDto<MaterialResponseDto>> search(
            @RequestParam(required = false) String query,
            @RequestParam(name = "category_id", required = false) Long categoryId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = materialService.search(query, categoryId, pageWindowResolver.resolve(limit, offset));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("category_id", categoryId);
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", params));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a material")
    public ResponseEntity<MaterialResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(materialService.get(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a material")
    public ResponseEntity<MaterialResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid MaterialUpdateRequestDto dto) {
        return ResponseEntity.ok(materialService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a material")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        materialService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
