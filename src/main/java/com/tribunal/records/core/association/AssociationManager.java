package com.tribunal.records.core.association;

import com.tribunal.records.core.domain.EntityRecord;
import com.tribunal.records.core.jdbc.DuplicateKeyViolation;
import com.tribunal.records.core.jdbc.QueryExecutor;
import com.tribunal.records.exception.BadRequestException;
import com.tribunal.records.exception.CaseRecordsException;
import com.tribunal.records.exception.ConflictException;
import com.tribunal.records.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maintains the rows of one many-to-many link table.
 * <p>
 * Both referenced entities are checked before a link is inserted; the store's unique and
 * foreign-key constraints back those checks up under concurrent writers. No statement here
 * runs inside a shared transaction, so every link written by {@link #associateMany} stays
 * committed whatever happens to the rest of the batch.
 */
public class AssociationManager {

    private static final Logger logger = LoggerFactory.getLogger(AssociationManager.class);

    private final AssociationConfig config;
    private final QueryExecutor queryExecutor;

    public AssociationManager(AssociationConfig config, QueryExecutor queryExecutor) {
        this.config = config;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Links two entities. Checks run in order: left exists, right exists, pair is new.
     * @throws NotFoundException if either entity is missing
     * @throws ConflictException if the pair is already linked
     */
    public Association associate(long leftId, long rightId) {
        requireExists(config.getLeft(), leftId);
        return link(leftId, rightId);
    }

    /**
     * Removes a link. Removing a link that does not exist is an error, not a no-op.
     * @throws NotFoundException if the pair is not linked
     */
    public Association disassociate(long leftId, long rightId) {
        if (!exists(leftId, rightId)) {
            throw notAssociated(leftId, rightId);
        }

        String sql = "DELETE FROM " + config.getLinkTable()
                + " WHERE " + config.getLeftColumn() + " = ? AND " + config.getRightColumn() + " = ?";
        // a concurrent removal may have won since the check
        if (queryExecutor.update(sql, leftId, rightId) == 0) {
            throw notAssociated(leftId, rightId);
        }

        logger.info("Removed {} {} from {} {}", config.getRight().getLabel(), rightId,
                config.getLeft().getLabel(), leftId);
        return Association.of(leftId, rightId);
    }

    /**
     * Full right-side rows linked to a left entity, ordered by the right side's display column.
     */
    public List<EntityRecord> listByLeft(long leftId) {
        EntityTable right = config.getRight();
        String sql = "SELECT " + right.selectClause("e") + " FROM " + right.getTable() + " e"
                + " INNER JOIN " + config.getLinkTable() + " l ON e." + right.getIdColumn()
                + " = l." + config.getRightColumn()
                + right.joinClause("e")
                + " WHERE l." + config.getLeftColumn() + " = ?"
                + " ORDER BY " + right.orderClause("e");
        return toRecords(queryExecutor.query(sql, leftId));
    }

    /**
     * Full left-side rows linked to a right entity, in the left side's configured order,
     * with the columns of the left side's joined tables.
     */
    public List<EntityRecord> listByRight(long rightId) {
        EntityTable left = config.getLeft();
        String sql = "SELECT " + left.selectClause("e") + " FROM " + left.getTable() + " e"
                + " INNER JOIN " + config.getLinkTable() + " l ON e." + left.getIdColumn()
                + " = l." + config.getLeftColumn()
                + left.joinClause("e")
                + " WHERE l." + config.getRightColumn() + " = ?"
                + " ORDER BY " + left.orderClause("e");
        return toRecords(queryExecutor.query(sql, rightId));
    }

    public boolean exists(long leftId, long rightId) {
        String sql = "SELECT " + config.getLeftColumn() + " FROM " + config.getLinkTable()
                + " WHERE " + config.getLeftColumn() + " = ? AND " + config.getRightColumn() + " = ?";
        return !queryExecutor.query(sql, leftId, rightId).isEmpty();
    }

    public long countByLeft(long leftId) {
        String sql = "SELECT COUNT(*) AS total FROM " + config.getLinkTable()
                + " WHERE " + config.getLeftColumn() + " = ?";
        Object total = queryExecutor.query(sql, leftId).get(0).get("total");
        return ((Number) total).longValue();
    }

    /**
     * Links many right entities to one left entity, one independent statement per item.
     * <p>
     * The left entity is checked once and fails the whole batch. After that a failing item
     * (missing entity, existing link) is recorded and the batch goes on.
     * @return one outcome per input id, in input order
     * @throws BadRequestException if no ids are given
     * @throws NotFoundException   if the left entity is missing
     */
    public List<AssociationOutcome> associateMany(long leftId, List<Long> rightIds) {
        if (rightIds == null || rightIds.isEmpty()) {
            throw new BadRequestException("At least one " + config.getRight().getLabel() + " id is required");
        }
        requireExists(config.getLeft(), leftId);

        List<AssociationOutcome> outcomes = new ArrayList<>(rightIds.size());
        for (Long rightId : rightIds) {
            outcomes.add(associateItem(leftId, rightId));
        }

        long associated = outcomes.stream().filter(AssociationOutcome::isAssociated).count();
        logger.info("Bulk association for {} {}: {} of {} associated", config.getLeft().getLabel(), leftId,
                associated, outcomes.size());
        return outcomes;
    }

    private AssociationOutcome associateItem(long leftId, Long rightId) {
        if (rightId == null) {
            return AssociationOutcome.failed(null, StringUtils.capitalize(config.getRight().getLabel()) + " id is required");
        }
        try {
            link(leftId, rightId);
            return AssociationOutcome.associated(rightId);
        } catch (CaseRecordsException | DataAccessException e) {
            logger.warn("Could not associate {} {} with {} {}: {}", config.getRight().getLabel(), rightId,
                    config.getLeft().getLabel(), leftId, e.getMessage());
            return AssociationOutcome.failed(rightId, e.getMessage());
        }
    }

    private Association link(long leftId, long rightId) {
        requireExists(config.getRight(), rightId);
        if (exists(leftId, rightId)) {
            throw alreadyAssociated(leftId, rightId, null);
        }

        String sql = "INSERT INTO " + config.getLinkTable()
                + " (" + config.getLeftColumn() + ", " + config.getRightColumn() + ") VALUES (?, ?)";
        try {
            queryExecutor.update(sql, leftId, rightId);
        } catch (DuplicateKeyViolation e) {
            throw alreadyAssociated(leftId, rightId, e);
        }

        logger.info("Associated {} {} with {} {}", config.getRight().getLabel(), rightId,
                config.getLeft().getLabel(), leftId);
        return Association.of(leftId, rightId);
    }

    private void requireExists(EntityTable entity, long id) {
        String sql = "SELECT " + entity.getIdColumn() + " FROM " + entity.getTable()
                + " WHERE " + entity.getIdColumn() + " = ?";
        if (queryExecutor.query(sql, id).isEmpty()) {
            throw new NotFoundException(StringUtils.capitalize(entity.getLabel()) + " " + id + " does not exist");
        }
    }

    private NotFoundException notAssociated(long leftId, long rightId) {
        return new NotFoundException(StringUtils.capitalize(config.getRight().getLabel()) + " " + rightId
                + " is not associated with " + config.getLeft().getLabel() + " " + leftId);
    }

    private ConflictException alreadyAssociated(long leftId, long rightId, DuplicateKeyViolation cause) {
        String message = StringUtils.capitalize(config.getRight().getLabel()) + " " + rightId
                + " is already associated with " + config.getLeft().getLabel() + " " + leftId;
        return cause != null ? new ConflictException(message, cause) : new ConflictException(message);
    }

    private List<EntityRecord> toRecords(List<Map<String, Object>> rows) {
        List<EntityRecord> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            records.add(new EntityRecord(row));
        }
        return records;
    }
}
