package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Base class of the error taxonomy shared by the catalog engine and the association manager.
 * Each subclass fixes the HTTP status and error code it is reported with.
 */
public abstract class CaseRecordsException extends RuntimeException {

    private final ErrorCode errorCode;
    private final HttpStatus status;

    protected CaseRecordsException(String message, ErrorCode errorCode, HttpStatus status) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected CaseRecordsException(String message, ErrorCode errorCode, HttpStatus status, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
