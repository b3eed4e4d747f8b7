package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientResponseDto;
import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientsResponseDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.entity.Quantity;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.jdc.catalog_manager.domain.entity.RecipeItem;
import com.jdc.catalog_manager.domain.repository.CatalogItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeItemRepository;
import com.jdc.catalog_manager.domain.repository.RecipeRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.RecipeItemMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class RecipeItemService {

    private final RecipeRepository recipeRepository;
    private final CatalogItemRepository catalogItemRepository;
    private final RecipeItemRepository recipeItemRepository;

    @Transactional
    public RecipeItem link(Long recipeId, Long itemId, Quantity quantity) {
        Recipe recipe = recipeRepository.findById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_RECIPE_ITEM_REFERENCE,
                        "Recipe " + recipeId + " does not exist"));
        CatalogItem item = catalogItemRepository.findById(itemId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVALID_RECIPE_ITEM_REFERENCE,
                        "Catalog item " + itemId + " does not exist"));
        return recipeItemRepository.save(RecipeItemMapper.toEntity(recipe, item, quantity));
    }

    /** Ingredients of a recipe in the order they were submitted. */
    @Transactional(readOnly = true)
    public RecipeIngredientsResponseDto getIngredients(Long recipeId) {
        if (!recipeRepository.existsById(recipeId)) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }
        List<RecipeIngredientResponseDto> ingredients = recipeItemRepository.findByRecipeIdOrderByIdAsc(recipeId)
                .stream()
                .map(RecipeItemMapper::toDto)
                .toList();
        return RecipeIngredientsResponseDto.of(recipeId, ingredients);
    }

    @Transactional
    public void deleteAllByRecipeId(Long recipeId) {
        recipeItemRepository.deleteByRecipeId(recipeId);
    }
}
