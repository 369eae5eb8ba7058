package com.querydesk.portal.dto;

import com.querydesk.portal.model.QueryStatus;

public record QueryFilter(QueryStatus status, String category, String searchText) {
    public static QueryFilter none() {
        return new QueryFilter(null, null, null);
    }
}
