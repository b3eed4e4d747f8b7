package com.jdc.catalog_manager.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "101", "Requested user does not exist."),
    DUPLICATE_EMAIL(HttpStatus.CONFLICT, "102", "Email is already registered."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "103", "Authentication is required."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "104", "Invalid email or password."),
    USER_ACCESS_DENIED(HttpStatus.FORBIDDEN, "105", "You may only manage your own account."),
    INVALID_CURRENT_PASSWORD(HttpStatus.BAD_REQUEST, "106", "Current password is incorrect."),

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "Requested recipe does not exist."),
    RECIPE_ACCESS_DENIED(HttpStatus.FORBIDDEN, "202", "You do not own this recipe."),
    INVALID_RECIPE_REQUEST(HttpStatus.BAD_REQUEST, "203", "Recipe request is invalid."),
    INVALID_RECIPE_ITEM_REFERENCE(HttpStatus.BAD_REQUEST, "204", "Recipe item references a missing recipe or catalog item."),

    // --- Catalog (300) ---
    CATALOG_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "301", "Requested catalog item does not exist."),
    DUPLICATE_CATALOG_ITEM(HttpStatus.CONFLICT, "302", "Catalog item with this name already exists."),
    CATALOG_ITEM_CONFLICT(HttpStatus.CONFLICT, "303", "Catalog item was created concurrently, please retry."),
    CATALOG_ITEM_IN_USE(HttpStatus.CONFLICT, "304", "Catalog item is referenced by recipes."),

    // --- Construction (400) ---
    CONSTRUCTION_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "Requested construction does not exist."),
    INVALID_CONSTRUCTION_STATUS(HttpStatus.BAD_REQUEST, "402", "Unknown construction status."),
    CONSTRUCTION_IN_USE(HttpStatus.CONFLICT, "403", "Construction still has storages."),

    // --- Category / Material (500) ---
    CATEGORY_NOT_FOUND(HttpStatus.NOT_FOUND, "501", "Requested category does not exist."),
    CATEGORY_IN_USE(HttpStatus.CONFLICT, "502", "Category is referenced by materials."),
    MATERIAL_NOT_FOUND(HttpStatus.NOT_FOUND, "503", "Requested material does not exist."),
    DUPLICATE_MATERIAL(HttpStatus.BAD_REQUEST, "504", "Material with this name already exists."),
    MATERIAL_IN_USE(HttpStatus.CONFLICT, "505", "Material is still stocked in a storage."),

    // --- Storage (600) ---
    STORAGE_NOT_FOUND(HttpStatus.NOT_FOUND, "601", "Requested storage does not exist."),
    STORAGE_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "602", "Material is not stocked in this storage."),
    INVALID_STORAGE_ITEM_REQUEST(HttpStatus.BAD_REQUEST, "603", "Storage item request is invalid."),
    STORAGE_ITEM_CONFLICT(HttpStatus.CONFLICT, "604", "Storage item was created concurrently, please retry."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "Invalid input value."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "Method not allowed."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "Internal server error."),
    NULL_POINTER(HttpStatus.BAD_REQUEST, "904", "Required data is missing."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "905", "Unsupported content type."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "906", "Database constraint violated."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
