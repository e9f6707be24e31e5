package com.tribunal.records.core.catalog;

import com.tribunal.records.exception.CatalogConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable mapping from catalog kind to its {@link TableConfig}.
 * Built once at startup and handed to the engine; never mutated afterwards.
 */
public final class TableConfigRegistry {

    private final Map<String, TableConfig> bySlug;
    private final Map<CatalogKind, TableConfig> byKind;

    private TableConfigRegistry(Map<CatalogKind, TableConfig> configs) {
        Map<String, TableConfig> slugs = new LinkedHashMap<>();
        configs.forEach((kind, config) -> slugs.put(kind.getSlug(), config));
        this.bySlug = Collections.unmodifiableMap(slugs);
        this.byKind = Collections.unmodifiableMap(new EnumMap<>(configs));
    }

    /**
     * Registry holding every {@link CatalogKind}.
     */
    public static TableConfigRegistry standard() {
        Map<CatalogKind, TableConfig> configs = new EnumMap<>(CatalogKind.class);
        for (CatalogKind kind : CatalogKind.values()) {
            configs.put(kind, kind.getConfig());
        }
        return new TableConfigRegistry(configs);
    }

    /**
     * Resolves the schema of a catalog kind.
     * @param kind the kind slug, e.g. {@code tipos-medidas-cautelares}
     * @throws CatalogConfigurationException if the kind is not registered
     */
    public TableConfig resolve(String kind) {
        TableConfig config = bySlug.get(kind);
        if (config == null) {
            throw new CatalogConfigurationException("Catalog kind is not registered: " + kind);
        }
        return config;
    }

    public TableConfig resolve(CatalogKind kind) {
        TableConfig config = byKind.get(kind);
        if (config == null) {
            throw new CatalogConfigurationException("Catalog kind is not registered: " + kind);
        }
        return config;
    }

    public Set<String> kinds() {
        return bySlug.keySet();
    }
}
