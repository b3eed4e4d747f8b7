package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.StorageUpdateRequestDto;
import com.jdc.catalog_manager.service.StorageService;
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
@RequestMapping("/api/v1/storages")
@RequiredArgsConstructor
@Tag(name = "Storages", description = "Storages on construction sites")
public class StorageController {

    private static final String PATH = "/api/v1/storages";

    private final StorageService storageService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Create a storage")
    public ResponseEntity<StorageResponseDto> create(@RequestBody @Valid StorageRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(storageService.create(dto));
    }

    @GetMapping
    @Operation(summary = "List storages, newest first")
    public ResponseEntity<PageResponseDto<StorageResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = storageService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All storages without paging")
    public ResponseEntity<List<StorageResponseDto>> listPublic() {
        return ResponseEntity.ok(storageService.listPublic());
    }

    @GetMapping("/construction/{constructionId}")
    @Operation(summary = "Storages of one construction")
    public ResponseEntity<PageResponseDto<StorageResponseDto>> listByConstruction(
            @PathVariable Long constructionId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = storageService.listByConstruction(constructionId, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/construction/" + constructionId, Map.of()));
    }

    @GetMapping("/search")
    @Operation(summary = "Search storages by name, optionally inside one construction")
    public ResponseEntity<PageResponseDto<StorageResponseDto>> search(
            @RequestParam(required = false) String query,
            @RequestParam(name = "construction_id", required = false) Long constructionId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = storageService.search(query, constructionId, pageWindowResolver.resolve(limit, offset));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("query", query);
        params.put("construction_id", constructionId);
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", params));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a storage")
    public ResponseEntity<StorageResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(storageService.get(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Rename a storage or move it to another construction")
    public ResponseEntity<StorageResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid StorageUpdateRequestDto dto) {
        return ResponseEntity.ok(storageService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a storage and its stock")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        storageService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
