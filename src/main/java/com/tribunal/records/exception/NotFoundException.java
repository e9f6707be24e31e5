package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Raised when a record, an entity referenced by an association, or an association itself is absent.
 */
public class NotFoundException extends CaseRecordsException {

    public NotFoundException(String message) {
        super(message, ErrorCode.NOT_FOUND, HttpStatus.NOT_FOUND);
    }
}
