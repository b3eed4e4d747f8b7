package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.category.CategoryRequestDto;
import com.jdc.catalog_manager.domain.dto.category.CategoryResponseDto;
import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.service.CategoryService;
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
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
@Tag(name = "Categories", description = "Material categories")
public class CategoryController {

    private static final String PATH = "/api/v1/categories";

    private final CategoryService categoryService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Create a category")
    public ResponseEntity<CategoryResponseDto> create(@RequestBody @Valid CategoryRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(categoryService.create(dto));
    }

    @GetMapping
    @Operation(summary = "List categories, newest first")
    public ResponseEntity<PageResponseDto<CategoryResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = categoryService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All categories without paging")
    public ResponseEntity<List<CategoryResponseDto>> listPublic() {
        return ResponseEntity.ok(categoryService.listPublic());
    }

    @GetMapping("/search")
    @Operation(summary = "Search categories by name")
    public ResponseEntity<PageResponseDto<CategoryResponseDto>> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = categoryService.search(query, pageWindowResolver.resolve(limit, offset));
        Map<String, String> params = query == null ? Map.of() : Map.of("query", query);
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", params));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a category")
    public ResponseEntity<CategoryResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(categoryService.get(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Rename a category")
    public ResponseEntity<CategoryResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid CategoryRequestDto dto) {
        return ResponseEntity.ok(categoryService.update(id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a category", description = "Refused with 409 while materials belong to it.")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        categoryService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
