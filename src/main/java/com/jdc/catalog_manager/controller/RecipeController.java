package com.jdc.catalog_manager.controller;

import com.jdc.catalog_manager.domain.dto.common.PageResponseDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeResponseDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeUpdateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientsResponseDto;
import com.jdc.catalog_manager.security.CustomUserDetails;
import com.jdc.catalog_manager.service.RecipeService;
import com.jdc.catalog_manager.util.PageWindowResolver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/recipes")
@RequiredArgsConstructor
@Tag(name = "Recipes", description = "Recipes and their ingredients")
public class RecipeController {

    private static final String PATH = "/api/v1/recipes";

    private final RecipeService recipeService;
    private final PageWindowResolver pageWindowResolver;

    @PostMapping
    @Operation(summary = "Create a recipe",
            description = "Ingredients are matched to the catalog by exact name; unknown names become new catalog items.")
    public ResponseEntity<RecipeResponseDto> create(
            @RequestBody RecipeCreateRequestDto request,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        RecipeResponseDto created = recipeService.createRecipe(userDetails.getUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    @Operation(summary = "List recipes, newest first")
    public ResponseEntity<PageResponseDto<RecipeResponseDto>> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = recipeService.list(pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH, Map.of()));
    }

    @GetMapping("/public")
    @Operation(summary = "All recipes without paging")
    public ResponseEntity<List<RecipeResponseDto>> listPublic() {
        return ResponseEntity.ok(recipeService.listPublic());
    }

    @GetMapping("/my")
    @Operation(summary = "Recipes of the current user")
    public ResponseEntity<PageResponseDto<RecipeResponseDto>> listMine(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        var slice = recipeService.listByUser(userDetails.getUserId(), pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/my", Map.of()));
    }

    @GetMapping("/user/{userId}")
    @Operation(summary = "Recipes of a given user")
    public ResponseEntity<PageResponseDto<RecipeResponseDto>> listByUser(
            @PathVariable Long userId,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = recipeService.listByUser(userId, pageWindowResolver.resolve(limit, offset));
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/user/" + userId, Map.of()));
    }

    @GetMapping("/search")
    @Operation(summary = "Search recipes by title substring")
    public ResponseEntity<PageResponseDto<RecipeResponseDto>> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long offset) {
        var slice = recipeService.search(query, pageWindowResolver.resolve(limit, offset));
        Map<String, String> params = query == null ? Map.of() : Map.of("query", query);
        return ResponseEntity.ok(PageResponseDto.of(slice, PATH + "/search", params));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a recipe")
    public ResponseEntity<RecipeResponseDto> get(@PathVariable Long id) {
        return ResponseEntity.ok(recipeService.getRecipe(id));
    }

    @GetMapping("/{id}/ingredients")
    @Operation(summary = "Ingredients of a recipe in submission order")
    public ResponseEntity<RecipeIngredientsResponseDto> ingredients(@PathVariable Long id) {
        return ResponseEntity.ok(recipeService.getIngredients(id));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a recipe (owner only)")
    public ResponseEntity<RecipeResponseDto> update(
            @PathVariable Long id,
            @RequestBody @Valid RecipeUpdateRequestDto dto,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        return ResponseEntity.ok(recipeService.updateRecipe(userDetails.getUserId(), id, dto));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a recipe (owner only)")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @AuthenticationPrincipal CustomUserDetails userDetails) {
        recipeService.deleteRecipe(userDetails.getUserId(), id);
        return ResponseEntity.noContent().build();
    }
}
