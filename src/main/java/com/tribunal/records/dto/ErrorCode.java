package com.tribunal.records.dto;

public enum ErrorCode {
    // General errors
    BAD_REQUEST("BAD_REQUEST", "Bad request"),
    NOT_FOUND("NOT_FOUND", "Resource not found"),
    CONFLICT("CONFLICT", "Resource conflict"),

    // Validation errors
    VALIDATION_ERROR("VALIDATION_ERROR", "Validation failed"),
    INVALID_FIELD_VALUE("INVALID_FIELD_VALUE", "Invalid field value"),

    // Data access errors
    DATA_ACCESS_ERROR("DATA_ACCESS_ERROR", "Data access error"),

    // Configuration errors
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", "Configuration error");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
