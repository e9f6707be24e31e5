package com.tribunal.records.core.jdbc;

import java.util.List;
import java.util.Map;

/**
 * Runs parameterized statements against the relational store.
 * <p>
 * Statement text may only contain identifiers taken from static configuration;
 * every value must be passed through {@code params} and bound by the driver.
 * Implementations report a duplicate unique key as {@link DuplicateKeyViolation} and a
 * delete or update blocked by a dependent table as {@link ReferencedRowViolation}.
 * Any other failure propagates as a {@link org.springframework.dao.DataAccessException}.
 */
public interface QueryExecutor {

    /**
     * Runs a query.
     * @param sql the statement text with {@code ?} placeholders
     * @param params the values bound to the placeholders, in order
     * @return the rows, each keyed case-insensitively by column label
     */
    List<Map<String, Object>> query(String sql, Object... params);

    /**
     * Runs an insert and returns the key the store generated for {@code keyColumn}.
     */
    long insert(String sql, String keyColumn, Object... params);

    /**
     * Runs an update or delete.
     * @return the number of affected rows
     */
    int update(String sql, Object... params);
}
