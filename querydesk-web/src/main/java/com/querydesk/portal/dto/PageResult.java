package com.querydesk.portal.dto;

import java.util.List;

/**
 * One page of a listing. {@code page} is 1-based; {@code total} counts every record matching
 * the filter.
 */
public record PageResult<T>(List<T> items, int page, int limit, long total, int totalPages) {
}
