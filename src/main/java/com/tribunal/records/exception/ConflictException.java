package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Raised on a uniqueness or referential-integrity violation, or a duplicate association.
 */
public class ConflictException extends CaseRecordsException {

    public ConflictException(String message) {
        super(message, ErrorCode.CONFLICT, HttpStatus.CONFLICT);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, ErrorCode.CONFLICT, HttpStatus.CONFLICT, cause);
    }
}
