package com.tribunal.records.dto;

import lombok.Value;

/**
 * Paging metadata attached to a listing response.
 */
@Value
public class Pagination {
    int page;
    int limit;
    long total;
    int totalPages;
    boolean hasNext;
    boolean hasPrev;

    public static Pagination of(int page, int limit, long total) {
        int totalPages = (int) ((total + limit - 1) / limit);
        return new Pagination(page, limit, total, totalPages, page < totalPages, page > 1);
    }
}
