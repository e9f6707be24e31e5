package com.tribunal.records.core.catalog;

import com.tribunal.records.core.jdbc.DuplicateKeyViolation;
import com.tribunal.records.core.jdbc.QueryExecutor;
import com.tribunal.records.core.jdbc.ReferencedRowViolation;
import com.tribunal.records.exception.BadRequestException;
import com.tribunal.records.exception.ConflictException;
import com.tribunal.records.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Generic CRUD over every catalog table registered in {@link TableConfigRegistry}.
 * <p>
 * All catalogs share this one code path; they differ only in the columns their
 * {@link TableConfig} declares. Table and column names in the statements come from the
 * registry alone. Names, search terms, ids and page bounds are always bound parameters.
 */
@Service
@Transactional
public class CatalogEngine {

    private static final Logger logger = LoggerFactory.getLogger(CatalogEngine.class);

    private final TableConfigRegistry registry;
    private final QueryExecutor queryExecutor;

    /**
     * Constructs a CatalogEngine.
     * @param registry      the catalog kinds this engine serves
     * @param queryExecutor the executor statements are run through
     */
    public CatalogEngine(TableConfigRegistry registry, QueryExecutor queryExecutor) {
        this.registry = registry;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Lists the records of a catalog ordered by name ascending.
     * @param kind  the catalog kind slug
     * @param query optional name filter and page window; the page is applied after ordering
     * @return the matching records
     */
    public List<CatalogRecord> list(String kind, CatalogQuery query) {
        TableConfig config = registry.resolve(kind);
        CatalogQuery effective = query != null ? query : CatalogQuery.all();

        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(config.getTable());
        List<Object> params = new ArrayList<>();
        appendSearch(sql, params, config, effective.getSearch());
        sql.append(" ORDER BY ").append(config.getNameColumn()).append(" ASC");

        if (effective.isPaged()) {
            long offset = effective.getOffset() != null ? effective.getOffset() : 0L;
            if (effective.getLimit() < 0 || offset < 0) {
                throw new BadRequestException("Limit and offset must not be negative");
            }
            sql.append(" LIMIT ? OFFSET ?");
            params.add(effective.getLimit());
            params.add(offset);
        }

        return toRecords(config, queryExecutor.query(sql.toString(), params.toArray()));
    }

    /**
     * Counts the records matching the same name filter as {@link #list}.
     * @param kind   the catalog kind slug
     * @param search optional case-insensitive substring of the name
     * @return the point-in-time count
     */
    public long count(String kind, String search) {
        TableConfig config = registry.resolve(kind);
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) AS total FROM ").append(config.getTable());
        List<Object> params = new ArrayList<>();
        appendSearch(sql, params, config, search);

        List<Map<String, Object>> rows = queryExecutor.query(sql.toString(), params.toArray());
        Object total = rows.get(0).get("total");
        return ((Number) total).longValue();
    }

    /**
     * Retrieves a record by its id.
     * @throws NotFoundException if no row has this id
     */
    public CatalogRecord getById(String kind, long id) {
        TableConfig config = registry.resolve(kind);
        String sql = "SELECT * FROM " + config.getTable() + " WHERE " + config.getIdColumn() + " = ?";
        List<Map<String, Object>> rows = queryExecutor.query(sql, id);
        if (rows.isEmpty()) {
            throw new NotFoundException("Record " + id + " not found in " + kind);
        }
        return new CatalogRecord(config, rows.get(0));
    }

    /**
     * Creates a record and returns it as stored, store defaults included.
     * The name is assumed present; the NOT NULL constraint is the only check made here.
     * @throws ConflictException if another record already has this name
     */
    public CatalogRecord create(String kind, CatalogPayload payload) {
        TableConfig config = registry.resolve(kind);
        logger.debug("Creating {} record named {}", kind, payload.getName());

        List<String> columns = new ArrayList<>();
        List<Object> values = new ArrayList<>();
        columns.add(config.getNameColumn());
        values.add(payload.getName());

        if (config.isHasDescription() && StringUtils.hasText(payload.getDescription())) {
            columns.add(TableConfig.DESCRIPTION_COLUMN);
            values.add(payload.getDescription());
        }
        for (ExtraColumn column : config.getExtraColumns()) {
            if (payload.getExtras().containsKey(column.getName())) {
                columns.add(column.getName());
                values.add(column.getType().coerce(column.getName(), payload.getExtras().get(column.getName())));
            }
        }

        String placeholders = columns.stream().map(column -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + config.getTable() + " (" + String.join(", ", columns) + ")"
                + " VALUES (" + placeholders + ")";

        long id;
        try {
            id = queryExecutor.insert(sql, config.getIdColumn(), values.toArray());
        } catch (DuplicateKeyViolation e) {
            throw duplicateName(config, payload.getName(), e);
        }

        logger.info("Created {} record with id {}", kind, id);
        return getById(kind, id);
    }

    /**
     * Updates the fields present in the payload and returns the record as stored.
     * @throws NotFoundException   if no row has this id
     * @throws BadRequestException if the payload carries no field this catalog can update
     * @throws ConflictException   if the new name belongs to another record
     */
    public CatalogRecord update(String kind, long id, CatalogPayload payload) {
        TableConfig config = registry.resolve(kind);
        getById(kind, id);

        List<String> assignments = new ArrayList<>();
        List<Object> values = new ArrayList<>();

        if (StringUtils.hasText(payload.getName())) {
            assignments.add(config.getNameColumn() + " = ?");
            values.add(payload.getName());
        }
        if (config.isHasDescription() && payload.isDescriptionPresent()) {
            assignments.add(TableConfig.DESCRIPTION_COLUMN + " = ?");
            values.add(payload.getDescription());
        }
        for (ExtraColumn column : config.getExtraColumns()) {
            if (payload.getExtras().containsKey(column.getName())) {
                assignments.add(column.getName() + " = ?");
                values.add(column.getType().coerce(column.getName(), payload.getExtras().get(column.getName())));
            }
        }

        if (assignments.isEmpty()) {
            throw new BadRequestException("No fields to update");
        }

        values.add(id);
        String sql = "UPDATE " + config.getTable() + " SET " + String.join(", ", assignments)
                + " WHERE " + config.getIdColumn() + " = ?";

        try {
            queryExecutor.update(sql, values.toArray());
        } catch (DuplicateKeyViolation e) {
            throw duplicateName(config, payload.getName(), e);
        }

        logger.info("Updated {} record with id {}", kind, id);
        return getById(kind, id);
    }

    /**
     * Deletes a record. Dependent rows are never cascaded.
     * @return the record as it was before deletion
     * @throws NotFoundException if no row has this id
     * @throws ConflictException if rows of another table still reference the record
     */
    public CatalogRecord remove(String kind, long id) {
        TableConfig config = registry.resolve(kind);
        CatalogRecord snapshot = getById(kind, id);

        String sql = "DELETE FROM " + config.getTable() + " WHERE " + config.getIdColumn() + " = ?";
        try {
            queryExecutor.update(sql, id);
        } catch (ReferencedRowViolation e) {
            throw new ConflictException(
                    "Cannot delete: records that use this " + config.getLabel() + " still exist", e);
        }

        logger.info("Deleted {} record with id {}", kind, id);
        return snapshot;
    }

    /**
     * Tells whether a record with exactly this name exists.
     * @param excludeId a record to ignore, so renaming a record to its own name is not a clash
     */
    public boolean existsByName(String kind, String name, Long excludeId) {
        TableConfig config = registry.resolve(kind);
        StringBuilder sql = new StringBuilder("SELECT ").append(config.getIdColumn())
                .append(" FROM ").append(config.getTable())
                .append(" WHERE ").append(config.getNameColumn()).append(" = ?");
        List<Object> params = new ArrayList<>();
        params.add(name);

        if (excludeId != null) {
            sql.append(" AND ").append(config.getIdColumn()).append(" <> ?");
            params.add(excludeId);
        }

        return !queryExecutor.query(sql.toString(), params.toArray()).isEmpty();
    }

    /**
     * Total and full content of a catalog.
     */
    public CatalogStats stats(String kind) {
        long total = count(kind, null);
        return new CatalogStats(kind, total, list(kind, CatalogQuery.all()));
    }

    private void appendSearch(StringBuilder sql, List<Object> params, TableConfig config, String search) {
        if (StringUtils.hasLength(search)) {
            sql.append(" WHERE LOWER(").append(config.getNameColumn()).append(") LIKE ?");
            params.add("%" + search.toLowerCase(Locale.ROOT) + "%");
        }
    }

    private List<CatalogRecord> toRecords(TableConfig config, List<Map<String, Object>> rows) {
        List<CatalogRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(new CatalogRecord(config, row));
        }
        return records;
    }

    private ConflictException duplicateName(TableConfig config, String name, DuplicateKeyViolation cause) {
        return new ConflictException("A " + config.getLabel() + " named \"" + name + "\" already exists", cause);
    }
}
