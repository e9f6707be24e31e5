package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Raised when the caller supplied nothing to change or a malformed batch.
 */
public class BadRequestException extends CaseRecordsException {

    public BadRequestException(String message) {
        super(message, ErrorCode.BAD_REQUEST, HttpStatus.BAD_REQUEST);
    }
}
