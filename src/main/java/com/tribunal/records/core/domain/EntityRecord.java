package com.tribunal.records.core.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.springframework.util.LinkedCaseInsensitiveMap;

import java.util.Collections;
import java.util.Map;

/**
 * A row read from the store, keyed case-insensitively by column name.
 * Serialized to JSON as its plain column map.
 */
@EqualsAndHashCode
@ToString
public class EntityRecord {

    private final Map<String, Object> columns;

    public EntityRecord(Map<String, Object> row) {
        LinkedCaseInsensitiveMap<Object> copy = new LinkedCaseInsensitiveMap<>(row.size());
        copy.putAll(row);
        this.columns = Collections.unmodifiableMap(copy);
    }

    @JsonAnyGetter
    public Map<String, Object> getColumns() {
        return columns;
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public Long getLong(String column) {
        Object value = columns.get(column);
        return value instanceof Number number ? number.longValue() : null;
    }

    public String getString(String column) {
        Object value = columns.get(column);
        return value != null ? value.toString() : null;
    }
}
