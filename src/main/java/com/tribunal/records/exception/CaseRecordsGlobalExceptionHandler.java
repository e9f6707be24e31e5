package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import com.tribunal.records.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Global exception handler for the case records endpoints.
 * Maps the error taxonomy, request validation failures and store errors to {@link ErrorResponse}.
 */
@RestControllerAdvice
public class CaseRecordsGlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(CaseRecordsGlobalExceptionHandler.class);

    /**
     * Handles NotFound, Conflict, BadRequest and configuration errors with the status each one carries.
     * A configuration error means code asked for a catalog that was never registered, so it is logged as an error.
     */
    @ExceptionHandler(CaseRecordsException.class)
    public ResponseEntity<ErrorResponse> handleCaseRecordsException(CaseRecordsException ex,
                                                                    HttpServletRequest request) {
        if (ex instanceof CatalogConfigurationException) {
            logger.error("Catalog configuration error on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        } else {
            logger.debug("{} on {}: {}", ex.getErrorCode().getCode(), request.getRequestURI(), ex.getMessage());
        }
        return build(ex.getStatus(), ex.getErrorCode(), ex.getMessage(), request);
    }

    /**
     * Handles IllegalArgumentException raised by request validation and returns 400.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex,
                                                                        HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorCode.VALIDATION_ERROR, ex.getMessage(), request);
    }

    /**
     * Handles bean validation failures on request bodies and lists the offending fields.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException ex,
                                                                      HttpServletRequest request) {
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> new ErrorResponse.FieldError(
                        error.getField(),
                        error.getRejectedValue() != null ? error.getRejectedValue().toString() : null,
                        error.getDefaultMessage()))
                .collect(Collectors.toList());
        ErrorResponse body = new ErrorResponse(HttpStatus.BAD_REQUEST.value(),
                HttpStatus.BAD_REQUEST.getReasonPhrase(), ErrorCode.VALIDATION_ERROR,
                ErrorCode.VALIDATION_ERROR.getDefaultMessage(), request.getRequestURI(), fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorCode.INVALID_FIELD_VALUE,
                "Invalid value for parameter " + ex.getName(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        return build(HttpStatus.BAD_REQUEST, ErrorCode.BAD_REQUEST, "Malformed request body", request);
    }

    /**
     * Handles store failures that are not part of the taxonomy and returns 500 without leaking SQL.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException ex,
                                                                   HttpServletRequest request) {
        logger.error("Data access error on {}", request.getRequestURI(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.DATA_ACCESS_ERROR,
                ErrorCode.DATA_ACCESS_ERROR.getDefaultMessage(), request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, ErrorCode code, String message,
                                                HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(status.value(), status.getReasonPhrase(), code, message,
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
