package com.querydesk.portal.dto;

import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;

import java.time.LocalDateTime;

public record RecentQuery(Long id, String name, String email, QueryStatus status, LocalDateTime createdAt) {
    public static RecentQuery from(Query query) {
        return new RecentQuery(query.getId(), query.getRequesterName(), query.getRequesterEmail(),
                query.getStatus(), query.getCreatedAt());
    }
}
