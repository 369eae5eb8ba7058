package com.querydesk.portal.dto;

public record StatusCounts(long total, long pending, long inProgress, long resolved) {
}
