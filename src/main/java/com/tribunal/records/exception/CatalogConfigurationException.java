package com.tribunal.records.exception;

import com.tribunal.records.dto.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * A catalog kind reached the engine without being registered.
 * This is a programming error, reported apart from data errors.
 */
public class CatalogConfigurationException extends CaseRecordsException {

    public CatalogConfigurationException(String message) {
        super(message, ErrorCode.CONFIGURATION_ERROR, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
