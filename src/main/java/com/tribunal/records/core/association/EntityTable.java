package com.tribunal.records.core.association;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One side of an association: the entity table and how its rows are ordered in listings.
 */
@Value
@Builder
public class EntityTable {
    String table;
    String idColumn;
    /** Singular noun used in diagnostics, e.g. "victim". */
    String label;
    /** Column the listings of this side are ordered by. */
    String orderColumn;
    boolean orderDescending;
    /** Related tables whose columns are added to this side's listing rows. */
    @Singular
    List<EntityJoin> joins;

    String selectClause(String alias) {
        StringBuilder select = new StringBuilder(alias).append(".*");
        joins.forEach(join -> select.append(join.selectClause()));
        return select.toString();
    }

    String joinClause(String alias) {
        StringBuilder sql = new StringBuilder();
        joins.forEach(join -> sql.append(join.joinClause(alias)));
        return sql.toString();
    }

    String orderClause(String alias) {
        return alias + "." + orderColumn + (orderDescending ? " DESC" : " ASC");
    }
}
