package com.device.registry.api;

import java.util.List;

/**
 * One page of a paginated query over review data.
 *
 * @param content       the elements on this page
 * @param totalElements number of matching elements across all pages
 * @param pageNumber    zero-based page index
 * @param pageSize      requested page size
 * @param <T>           the element type
 */
public record Page<T>(List<T> content, long totalElements, int pageNumber, int pageSize) {

    public Page {
        content = content != null ? List.copyOf(content) : List.of();
        if (totalElements < 0) {
            throw new IllegalArgumentException("totalElements must be >= 0");
        }
    }

    /**
     * Slices an already filtered and ordered list.
     */
    public static <T> Page<T> of(List<T> all, PageRequest request) {
        int total = all.size();
        int from = Math.min(request.offset(), total);
        int to = Math.min(request.offset() + request.limit(), total);
        return new Page<>(all.subList(from, to), total, request.pageNumber(), request.limit());
    }

    public boolean hasNext() {
        return (long) (pageNumber + 1) * pageSize < totalElements;
    }

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) Math.ceil((double) totalElements / pageSize);
    }
}
