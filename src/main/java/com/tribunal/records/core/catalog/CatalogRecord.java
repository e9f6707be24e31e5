package com.tribunal.records.core.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.tribunal.records.core.domain.EntityRecord;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Map;

/**
 * A catalog row. Its columns vary by kind, the id/name/description shape does not.
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class CatalogRecord extends EntityRecord {

    @JsonIgnore
    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final TableConfig config;

    public CatalogRecord(TableConfig config, Map<String, Object> row) {
        super(row);
        this.config = config;
    }

    @JsonIgnore
    public Long getId() {
        return getLong(config.getIdColumn());
    }

    @JsonIgnore
    public String getName() {
        return getString(config.getNameColumn());
    }

    @JsonIgnore
    public String getDescription() {
        return config.isHasDescription() ? getString(TableConfig.DESCRIPTION_COLUMN) : null;
    }
}
