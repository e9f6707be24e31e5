package com.tribunal.records.core.jdbc;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * An insert or update collided with a unique index or primary key.
 */
public class DuplicateKeyViolation extends StoreConstraintException {

    public DuplicateKeyViolation(DataIntegrityViolationException cause) {
        super("Duplicate unique key", cause);
    }
}
