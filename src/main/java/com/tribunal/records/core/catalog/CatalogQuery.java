package com.tribunal.records.core.catalog;

import lombok.Value;

/**
 * Filter and optional page window for a catalog listing.
 * Without a limit the whole table is returned.
 */
@Value
public class CatalogQuery {

    private static final CatalogQuery ALL = new CatalogQuery(null, null, null);

    String search;
    Integer limit;
    Long offset;

    public static CatalogQuery all() {
        return ALL;
    }

    public static CatalogQuery search(String search) {
        return new CatalogQuery(search, null, null);
    }

    public static CatalogQuery page(String search, int limit, long offset) {
        return new CatalogQuery(search, limit, offset);
    }

    public boolean isPaged() {
        return limit != null;
    }
}
