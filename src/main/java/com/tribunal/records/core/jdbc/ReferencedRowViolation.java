package com.tribunal.records.core.jdbc;

import org.springframework.dao.DataIntegrityViolationException;

/**
 * The row is still referenced by a foreign key of a dependent table.
 */
public class ReferencedRowViolation extends StoreConstraintException {

    public ReferencedRowViolation(DataIntegrityViolationException cause) {
        super("Row is referenced by a dependent table", cause);
    }
}
