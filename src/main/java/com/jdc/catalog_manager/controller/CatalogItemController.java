package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemDetailDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemRequestDto;
import com.jdc.catalog_manager.domain.dto.catalog.CatalogItemResponseDto;
import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.service.CatalogItemService;
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
@RequestMapping("/api/v1/catalog-items")
@RequiredArgsConstructor
@Tag(name = "Catalog items", description = "Shared ingredient catalog")
public class CatalogItemController {

    private static final String PATH = "/api/v1/catalog-items";

    private final CatalogItemService catalogItemService;
    private final PageWindowResolver pageWindowResolver;

    @GetMapping
    @Operation(summary = "List catalog items", description = "Most recently used first, never used last, then by name.")
    public ResponseEntity<PageResponseDto<CatalogItemResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = catalogItemService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All catalog items without paging")
    public ResponseEntity<List<CatalogItemResponseDto>> listPublic() {
        return ResponseEntity.ok(catalogItemService.listPublic());
    }

    @GetMapping("/search")
    @Operation(summary = "Search catalog items by name substring")
    public ResponseEntity<PageResponseDto<CatalogItemDetailDto>> search(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = catalogItemService.search(name, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", nameParam(name)));
    }

    @PostMapping
    @Operation(summary = "Create a catalog item")
    public ResponseEntity<CatalogItemResponseDto> create(@RequestBody @Valid CatalogItemRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogItemService.createItem(dto));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a catalog item")
    public ResponseEntity<CatalogItemDetailDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(catalogItemService.getItem(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Rename a catalog item")
    public ResponseEntity<CatalogItemDetailDto> update(
            @PathVariable Long id,
            @RequestBody @Valid CatalogItemRequestDto dto) {
        return ResponseEntity.ok(catalogItemService.updateItem(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a catalog item", description = "Refused with 409 while any recipe uses the item.")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        catalogItemService.deleteItem(id);
        return ResponseEntity.noContent().build();
    }

    private static Map<String, String> nameParam(String name) {
        return name == null ? Map.of() : Map.of("name", name);
    }
}
