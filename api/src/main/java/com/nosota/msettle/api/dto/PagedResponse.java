package com.nosota.msettle.api.dto;

import java.util.List;

/**
 * Page of results with pagination metadata.
 *
 * @param data         Records of the current page
 * @param pageNumber   Current page number (0-indexed)
 * @param pageSize     Maximum number of records per page
 * @param totalRecords Total number of records across all pages
 * @param <T>          Record type
 */
public record PagedResponse<T>(
        List<T> data,
        int pageNumber,
        int pageSize,
        long totalRecords
) {
    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalRecords / pageSize);
    }
}
