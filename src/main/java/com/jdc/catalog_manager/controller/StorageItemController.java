package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemBulkRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemRequestDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemResponseDto;
import com.jdc.catalog_manager.domain.dto.storage.item.StorageItemUpdateRequestDto;
import com.jdc.catalog_manager.service.StorageItemService;
import com.jdc.catalog_manager.util.PageWindowResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/storage-items")
@RequiredArgsConstructor
@Tag(name = "Storage items", description = "Material stock per storage")
public class StorageItemController {

    private static final String PATH = "/api/v1/storage-items";

    private final StorageItemService storageItemService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Deliver a material to a storage",
            description = "Adds the quantity to the existing stock, or creates the stock entry.")
    public ResponseEntity<StorageItemResponseDto> upsert(@RequestBody @Valid StorageItemRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(storageItemService.upsert(dto));
    }

    @PostMapping("/storage/{storageId}/bulk")
    @Operation(summary = "Deliver several materials to one storage", description = "All or nothing.")
    public ResponseEntity<List<StorageItemResponseDto>> upsertBulk(
            @PathVariable Long storageId,
            @RequestBody @Valid StorageItemBulkRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(storageItemService.upsertBulk(storageId, dto));
    }

    @GetMapping("/storage/{storageId}")
    @Operation(summary = "Stock of one storage")
    public ResponseEntity<PageResponseDto<StorageItemResponseDto>> listByStorage(
            @PathVariable Long storageId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = storageItemService.listByStorage(storageId, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/storage/" + storageId, Map.of()));
    }

    @GetMapping("/material/{materialId}")
    @Operation(summary = "Storages holding one material")
    public ResponseEntity<PageResponseDto<StorageItemResponseDto>> listByMaterial(
            @PathVariable Long materialId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = storageItemService.listByMaterial(materialId, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/material/" + materialId, Map.of()));
    }

    @GetMapping("/storage/{storageId}/material/{materialId}")
    @Operation(summary = "Stock of one material in one storage")
    public ResponseEntity<StorageItemResponseDto> get(@PathVariable Long storageId, @PathVariable Long materialId) {
        return ResponseEntity.ok(storageItemService.get(storageId, materialId));
    }

    @PutMapping("/storage/{storageId}/material/{materialId}")
    @Operation(summary = "Set the stock of one material in one storage")
    public ResponseEntity<StorageItemResponseDto> update(
            @PathVariable Long storageId,
            @PathVariable Long materialId,
            @RequestBody @Valid StorageItemUpdateRequestDto dto) {
        return ResponseEntity.ok(storageItemService.update(storageId, materialId, dto));
    }

    @DeleteMapping("/storage/{storageId}/material/{materialId}")
    @Operation(summary = "Remove a material from a storage")
    public ResponseEntity<Void> delete(@PathVariable Long storageId, @PathVariable Long materialId) {
        storageItemService.delete(storageId, materialId);
        return ResponseEntity.noContent().build();
    }
}
