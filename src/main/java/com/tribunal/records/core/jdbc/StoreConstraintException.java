package com.tribunal.records.core.jdbc;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * A constraint enforced by the store rejected a statement.
 */
public abstract class StoreConstraintException extends RuntimeException {

    protected StoreConstraintException(String message, DataIntegrityViolationException cause) {
        super(message, cause);
    }
}
