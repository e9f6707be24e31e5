package com.tribunal.records.core.catalog;

import lombok.Value;

/**
 * An optional typed column specific to one catalog kind.
 */
@Value(staticConstructor = "of")
public class ExtraColumn {
    String name;
    ColumnType type;
}
