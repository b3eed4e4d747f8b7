package com.jdc.catalog_manager.service;

import com.jdc.catalog_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeResponseDto;
import com.jdc.catalog_manager.domain.dto.recipe.RecipeUpdateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientsResponseDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.entity.Quantity;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.jdc.catalog_manager.domain.entity.User;
import com.jdc.catalog_manager.domain.repository.RecipeRepository;
import com.jdc.catalog_manager.domain.repository.UserRepository;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.mapper.RecipeMapper;
import com.jdc.catalog_manager.service.validation.RecipeRequestValidator;
import com.jdc.catalog_manager.util.PageSlice;
import com.jdc.catalog_manager.util.PageWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeService {

    private static final int MAX_TRIES = 2;

    private final UserRepository userRepository;
    private final RecipeRepository recipeRepository;
    private final CatalogItemService catalogItemService;
    private final RecipeItemService recipeItemService;
    private final RecipeRequestValidator recipeRequestValidator;
    private final TransactionTemplate transactionTemplate;

    /**
     * Creates a recipe and links every ingredient to the catalog, creating
     * catalog items for names seen for the first time.
     *
     * <p>The whole request is validated before the transaction opens. Each
     * attempt runs in its own transaction; when another writer inserts the same
     * catalog name first, the attempt is rolled back and replayed once so it
     * links to the winner's row. A second conflict is reported as 409.
     */
    public RecipeResponseDto createRecipe(Long ownerId, RecipeCreateRequestDto request) {
        recipeRequestValidator.validate(request);

        for (int attempt = 1; attempt <= MAX_TRIES; attempt++) {
            try {
                RecipeResponseDto created = transactionTemplate.execute(status -> createInTransaction(ownerId, request));
                log.info("Recipe created: id={}, owner={}, ingredients={}",
                        created.getId(), ownerId, sizeOf(request.getIngredients()));
                return created;
            } catch (CustomException e) {
                if (e.getErrorCode() != ErrorCode.CATALOG_ITEM_CONFLICT) {
                    throw e;
                }
                if (attempt == MAX_TRIES) {
                    log.warn("Catalog name conflict persisted after {} attempts for owner {}", MAX_TRIES, ownerId);
                    throw e;
                }
                log.warn("Catalog name conflict on attempt {}/{} for owner {}, retrying", attempt, MAX_TRIES, ownerId);
            }
        }
        throw new CustomException(ErrorCode.INTERNAL_SERVER_ERROR, "Recipe creation exhausted its attempts");
    }

    private RecipeResponseDto createInTransaction(Long ownerId, RecipeCreateRequestDto request) {
        User owner = userRepository.findById(ownerId)
                .orElseThrow(() -> new CustomException(ErrorCode.USER_NOT_FOUND));

        Recipe recipe = recipeRepository.save(RecipeMapper.toEntity(request, owner));
        LocalDateTime usedAt = LocalDateTime.now();

        List<RecipeIngredientRequestDto> ingredients = request.getIngredients();
        if (ingredients != null) {
            for (RecipeIngredientRequestDto ingredient : ingredients) {
                CatalogItem item = catalogItemService.findOrCreate(ingredient.getName());
                Quantity quantity = Quantity.of(ingredient.getQuantityValue(), ingredient.getQuantityUnit());
                recipeItemService.link(recipe.getId(), item.getId(), quantity);
                catalogItemService.touchLastUsed(item, usedAt);
            }
        }
        return RecipeMapper.toDto(recipe);
    }

    @Transactional(readOnly = true)
    public RecipeResponseDto getRecipe(Long recipeId) {
        return RecipeMapper.toDto(getEntity(recipeId));
    }

    public RecipeIngredientsResponseDto getIngredients(Long recipeId) {
        return recipeItemService.getIngredients(recipeId);
    }

    @Transactional
    public RecipeResponseDto updateRecipe(Long userId, Long recipeId, RecipeUpdateRequestDto dto) {
        Recipe recipe = getOwnedEntity(userId, recipeId);
        recipe.update(
                dto.getTitle(),
                dto.getExternalUrl(),
                dto.getImageUrl(),
                dto.getPreparationSteps(),
                dto.getPrepTimeMinutes()
        );
        log.info("Recipe updated: id={}, owner={}", recipeId, userId);
        return RecipeMapper.toDto(recipe);
    }

    /** Removes the recipe and its ingredient links. Catalog items stay. */
    @Transactional
    public void deleteRecipe(Long userId, Long recipeId) {
        getOwnedEntity(userId, recipeId);
        recipeItemService.deleteAllByRecipeId(recipeId);
        recipeRepository.deleteById(recipeId);
        log.info("Recipe deleted: id={}, owner={}", recipeId, userId);
    }

    @Transactional(readOnly = true)
    public PageSlice<RecipeResponseDto> list(PageWindow window) {
        return page(null, null, window);
    }

    @Transactional(readOnly = true)
    public List<RecipeResponseDto> listPublic() {
        return recipeRepository.findAllByOrderByCreatedAtDescIdDesc().stream()
                .map(RecipeMapper::toDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public PageSlice<RecipeResponseDto> listByUser(Long userId, PageWindow window) {
        if (!userRepository.existsById(userId)) {
            throw new CustomException(ErrorCode.USER_NOT_FOUND);
        }
        return page(userId, null, window);
    }

    @Transactional(readOnly = true)
    public PageSlice<RecipeResponseDto> search(String query, PageWindow window) {
        return page(null, query, window);
    }

    private PageSlice<RecipeResponseDto> page(Long userId, String title, PageWindow window) {
        List<Recipe> recipes = recipeRepository.findPage(userId, title, window.offset(), window.limit());
        long total = recipeRepository.countPage(userId, title);
        return new PageSlice<>(recipes, total, window).map(RecipeMapper::toDto);
    }

    private Recipe getEntity(Long recipeId) {
        return recipeRepository.findWithUserById(recipeId)
                .orElseThrow(() -> new CustomException(ErrorCode.RECIPE_NOT_FOUND));
    }

    private Recipe getOwnedEntity(Long userId, Long recipeId) {
        Recipe recipe = getEntity(recipeId);
        if (!recipe.isOwnedBy(userId)) {
            throw new CustomException(ErrorCode.RECIPE_ACCESS_DENIED);
        }
        return recipe;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
