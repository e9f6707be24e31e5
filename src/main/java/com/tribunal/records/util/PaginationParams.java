package com.tribunal.records.util;

import lombok.Value;

/**
 * A 1-based page number turned into a LIMIT/OFFSET window.
 */
@Value
public class PaginationParams {
    int page;
    int limit;
    long offset;

    /**
     * Normalizes raw paging input: page at least 1, limit between 1 and {@code maxLimit}.
     * A missing or zero limit falls back to {@code defaultLimit}.
     */
    public static PaginationParams of(Integer page, Integer limit, int defaultLimit, int maxLimit) {
        int pageNumber = page != null ? Math.max(1, page) : 1;
        int size = limit != null && limit != 0 ? limit : defaultLimit;
        size = Math.min(Math.max(1, size), maxLimit);
        return new PaginationParams(pageNumber, size, (long) (pageNumber - 1) * size);
    }
}
