package com.tribunal.records.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Body returned for every failed API call.
 * Carries the HTTP status, the stable error code of the taxonomy and, for
 * bean-validation failures, the offending fields.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    /** Timestamp when the error occurred. */
    private LocalDateTime timestamp;
    /** HTTP status code of the error. */
    private int status;
    /** HTTP reason phrase. */
    private String error;
    /** Stable code from {@link ErrorCode}. */
    private String code;
    private String message;
    /** Request path that caused the error. */
    private String path;
    private List<FieldError> fieldErrors;

    /**
     * Represents a validation error for a specific field.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FieldError {
        private String field;
        private String rejectedValue;
        private String message;
    }

    /**
     * Constructs an ErrorResponse stamped with the current time.
     * @param status HTTP status code
     * @param error HTTP reason phrase
     * @param code error code of the taxonomy
     * @param message human-readable error message
     * @param path request path that caused the error
     */
    public ErrorResponse(int status, String error, ErrorCode code, String message, String path) {
        this.timestamp = LocalDateTime.now();
        this.status = status;
        this.error = error;
        this.code = code != null ? code.getCode() : null;
        this.message = message;
        this.path = path;
    }

    /**
     * Constructs an ErrorResponse with field errors.
     */
    public ErrorResponse(int status, String error, ErrorCode code, String message, String path,
                         List<FieldError> fieldErrors) {
        this(status, error, code, message, path);
        this.fieldErrors = fieldErrors;
    }
}
