package com.jdc.catalog_manager.service.validation;

import com.jdc.catalog_manager.domain.dto.recipe.RecipeCreateRequestDto;
import com.jdc.catalog_manager.domain.dto.recipe.ingredient.RecipeIngredientRequestDto;
import com.jdc.catalog_manager.domain.entity.CatalogItem;
import com.jdc.catalog_manager.domain.entity.Quantity;
import com.jdc.catalog_manager.domain.entity.Recipe;
import com.jdc.catalog_manager.exception.CustomException;
import com.jdc.catalog_manager.exception.ErrorCode;
import com.jdc.catalog_manager.exception.FieldErrorDetail;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a recipe creation request in one pass and reports every offending
 * field together, before anything is written.
 */
@Component
public class RecipeRequestValidator {

    static final int MAX_EXTERNAL_URL_LENGTH = 2048;
    static final int MAX_IMAGE_URL_LENGTH = 500;
    static final int MAX_QUANTITY_SCALE = 2;
    static final int MAX_QUANTITY_INTEGER_DIGITS = 6;

    public void validate(RecipeCreateRequestDto request) {
        if (request == null) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_REQUEST, "Request body is required");
        }
        List<FieldErrorDetail> errors = new ArrayList<>();

        String title = request.getTitle();
        if (title == null || title.isBlank()) {
            errors.add(new FieldErrorDetail("title", "must not be blank"));
        } else if (title.length() > Recipe.MAX_TITLE_LENGTH) {
            errors.add(new FieldErrorDetail("title", "must be at most " + Recipe.MAX_TITLE_LENGTH + " characters"));
        }

        if (request.getPrepTimeMinutes() != null && request.getPrepTimeMinutes() < 0) {
            errors.add(new FieldErrorDetail("prep_time_minutes", "must not be negative"));
        }

        String externalUrl = request.getExternalUrl();
        if (externalUrl != null && !externalUrl.isBlank()) {
            if (!(externalUrl.startsWith("http://") || externalUrl.startsWith("https://"))) {
                errors.add(new FieldErrorDetail("external_url", "must start with http:// or https://"));
            } else if (externalUrl.length() > MAX_EXTERNAL_URL_LENGTH) {
                errors.add(new FieldErrorDetail("external_url", "must be at most " + MAX_EXTERNAL_URL_LENGTH + " characters"));
            }
        }

        if (request.getImageUrl() != null && request.getImageUrl().length() > MAX_IMAGE_URL_LENGTH) {
            errors.add(new FieldErrorDetail("image_url", "must be at most " + MAX_IMAGE_URL_LENGTH + " characters"));
        }

        List<RecipeIngredientRequestDto> ingredients = request.getIngredients();
        if (ingredients != null) {
            for (int i = 0; i < ingredients.size(); i++) {
                validateIngredient(ingredients.get(i), "ingredients[" + i + "]", errors);
            }
        }

        if (!errors.isEmpty()) {
            throw new CustomException(ErrorCode.INVALID_RECIPE_REQUEST, errors);
        }
    }

    private void validateIngredient(RecipeIngredientRequestDto ingredient, String path, List<FieldErrorDetail> errors) {
        if (ingredient == null) {
            errors.add(new FieldErrorDetail(path, "must not be null"));
            return;
        }

        String name = ingredient.getName();
        if (name == null || name.isBlank()) {
            errors.add(new FieldErrorDetail(path + ".name", "must not be blank"));
        } else if (name.length() > CatalogItem.MAX_NAME_LENGTH) {
            errors.add(new FieldErrorDetail(path + ".name", "must be at most " + CatalogItem.MAX_NAME_LENGTH + " characters"));
        }

        if (ingredient.getQuantityValue() == null) {
            errors.add(new FieldErrorDetail(path + ".quantity_value", "must not be null"));
        } else if (ingredient.getQuantityValue().signum() < 0) {
            errors.add(new FieldErrorDetail(path + ".quantity_value", "must not be negative"));
        } else if (!fitsQuantityColumn(ingredient.getQuantityValue())) {
            errors.add(new FieldErrorDetail(path + ".quantity_value",
                    "must have at most " + MAX_QUANTITY_INTEGER_DIGITS + " integer digits and "
                            + MAX_QUANTITY_SCALE + " decimal places"));
        }

        String unit = ingredient.getQuantityUnit();
        if (unit == null || unit.isBlank()) {
            errors.add(new FieldErrorDetail(path + ".quantity_unit", "must not be blank"));
        } else if (unit.length() > Quantity.MAX_UNIT_LENGTH) {
            errors.add(new FieldErrorDetail(path + ".quantity_unit", "must be at most " + Quantity.MAX_UNIT_LENGTH + " characters"));
        }
    }

    // quantity_value is DECIMAL(8,2)
    private boolean fitsQuantityColumn(BigDecimal value) {
        BigDecimal normalized = value.stripTrailingZeros();
        int scale = Math.max(normalized.scale(), 0);
        int integerDigits = normalized.precision() - normalized.scale();
        return scale <= MAX_QUANTITY_SCALE && integerDigits <= MAX_QUANTITY_INTEGER_DIGITS;
    }
}
