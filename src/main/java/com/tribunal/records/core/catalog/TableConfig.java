package com.tribunal.records.core.catalog;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Physical schema of one catalog table.
 * <p>
 * Every identifier held here is interpolated into statement text by {@link CatalogEngine},
 * so instances are only ever built from {@link CatalogKind}.
 */
@Value
@Builder
public class TableConfig {

    public static final String DESCRIPTION_COLUMN = "descripcion";

    /** Kind slug as used in request paths. */
    String kind;
    String table;
    String idColumn;
    String nameColumn;
    boolean hasDescription;
    @Singular
    List<ExtraColumn> extraColumns;
    /** Singular noun naming one record, used in diagnostics. */
    String label;

    public Optional<ExtraColumn> findExtraColumn(String name) {
        return extraColumns.stream()
                .filter(column -> column.getName().equals(name))
                .findFirst();
    }
}
