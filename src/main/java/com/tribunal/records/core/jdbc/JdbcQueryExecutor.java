package com.tribunal.records.core.jdbc;

import com.tribunal.records.util.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ArgumentPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link QueryExecutor} backed by Spring's {@link JdbcTemplate}.
 * Relies on Spring's SQL error-code translation for duplicate keys and inspects the
 * vendor code of the remaining integrity violations to recognise a referenced row.
 */
public class JdbcQueryExecutor implements QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(JdbcQueryExecutor.class);

    // MySQL ER_ROW_IS_REFERENCED, ER_ROW_IS_REFERENCED_2; H2 REFERENTIAL_INTEGRITY_VIOLATED_CHILD_EXISTS
    private static final Set<Integer> REFERENCED_ROW_CODES = Set.of(1217, 1451, 23503);

    private final JdbcTemplate jdbcTemplate;
    private final InputSanitizer inputSanitizer;

    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate, InputSanitizer inputSanitizer) {
        this.jdbcTemplate = jdbcTemplate;
        this.inputSanitizer = inputSanitizer;
    }

    @Override
    public List<Map<String, Object>> query(String sql, Object... params) {
        logStatement(sql, params);
        try {
            List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, params);
            logger.debug("Query returned {} row(s)", rows.size());
            return rows;
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
    }

    @Override
    public long insert(String sql, String keyColumn, Object... params) {
        logStatement(sql, params);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(connection -> {
                PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
                new ArgumentPreparedStatementSetter(params).setValues(ps);
                return ps;
            }, keyHolder);
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
        long key = extractKey(keyHolder, keyColumn);
        logger.debug("Insert generated {} = {}", keyColumn, key);
        return key;
    }

    @Override
    public int update(String sql, Object... params) {
        logStatement(sql, params);
        try {
            int affected = jdbcTemplate.update(sql, params);
            logger.debug("Statement affected {} row(s)", affected);
            return affected;
        } catch (DataIntegrityViolationException e) {
            throw translate(e);
        }
    }

    private RuntimeException translate(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return new DuplicateKeyViolation(e);
        }
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SQLException sqlException
                && REFERENCED_ROW_CODES.contains(sqlException.getErrorCode())) {
            return new ReferencedRowViolation(e);
        }
        return e;
    }

    private long extractKey(KeyHolder keyHolder, String keyColumn) {
        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.isEmpty()) {
            throw new DataRetrievalFailureException("No generated key returned for column " + keyColumn);
        }
        Map<String, Object> generated = keys.get(0);
        for (Map.Entry<String, Object> entry : generated.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(keyColumn) && entry.getValue() instanceof Number number) {
                return number.longValue();
            }
        }
        // MySQL reports the key as GENERATED_KEY
        for (Object value : generated.values()) {
            if (value instanceof Number number) {
                return number.longValue();
            }
        }
        throw new DataRetrievalFailureException("Generated key for column " + keyColumn + " is not numeric");
    }

    private void logStatement(String sql, Object[] params) {
        if (logger.isDebugEnabled()) {
            logger.debug("SQL: {} | params: {}", sql.strip(),
                    inputSanitizer.sanitizeForLogging(Arrays.toString(params)));
        }
    }
}
