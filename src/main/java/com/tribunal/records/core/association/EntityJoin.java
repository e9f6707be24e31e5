package com.tribunal.records.core.association;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A table joined to an entity's listing rows to carry a few of its columns along.
 * The join is outer, so a row whose foreign key is null still lists.
 */
@Value
@Builder
public class EntityJoin {
    String table;
    String alias;
    /** Column of the listed entity that holds the foreign key. */
    String foreignKey;
    String referencedColumn;
    /** Joined column name to the label it is returned under. */
    @Singular
    Map<String, String> columns;

    String selectClause() {
        StringBuilder select = new StringBuilder();
        columns.forEach((column, label) ->
                select.append(", ").append(alias).append('.').append(column).append(" AS ").append(label));
        return select.toString();
    }

    String joinClause(String ownerAlias) {
        return " LEFT JOIN " + table + " " + alias
                + " ON " + ownerAlias + "." + foreignKey + " = " + alias + "." + referencedColumn;
    }
}
