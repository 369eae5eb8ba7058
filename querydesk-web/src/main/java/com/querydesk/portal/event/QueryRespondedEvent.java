package com.querydesk.portal.event;

import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;

/**
 * Published when an admin stores a new response on a query.
 */
public record QueryRespondedEvent(
        Long queryId,
        String requesterName,
        String requesterEmail,
        boolean guest,
        String category,
        String message,
        String adminResponse,
        QueryStatus status
) {
    public static QueryRespondedEvent from(Query query) {
        return new QueryRespondedEvent(
                query.getId(),
                query.getRequesterName(),
                query.getRequesterEmail(),
                query.isGuest(),
                query.getCategory(),
                query.getMessage(),
                query.getAdminResponse(),
                query.getStatus());
    }
}
