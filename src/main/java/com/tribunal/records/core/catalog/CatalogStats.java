package com.tribunal.records.core.catalog;

import lombok.Value;

import java.util.List;

/**
 * Size and full content of one catalog.
 */
@Value
public class CatalogStats {
    String kind;
    long total;
    List<CatalogRecord> records;
}
