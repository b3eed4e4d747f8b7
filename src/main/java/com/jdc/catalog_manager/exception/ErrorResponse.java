package com.jdc.catalog_manager.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.List;

@Getter
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ErrorResponse {
    private final String code;
    private final String message;
    private String errorId;
    private List<FieldErrorDetail> fieldErrors;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorResponse(String code, String message, String errorId) {
        this.code = code;
        this.message = message;
        this.errorId = errorId;
    }

    public ErrorResponse(String code, String message, List<FieldErrorDetail> fieldErrors) {
        this.code = code;
        this.message = message;
        this.fieldErrors = fieldErrors;
    }

    public static ErrorResponse of(ErrorCode errorCode) {
        return new ErrorResponse(errorCode.getCode(), errorCode.getMessage());
    }

    public static ErrorResponse of(CustomException ex) {
        ErrorCode errorCode = ex.getErrorCode();
        return new ErrorResponse(errorCode.getCode(), ex.getMessage(), ex.getFieldErrors());
    }
}
