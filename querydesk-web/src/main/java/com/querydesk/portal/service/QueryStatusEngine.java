package com.querydesk.portal.service;

import com.querydesk.portal.exception.InvalidStatusException;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Applies admin-triggered status changes and responses to a query.
 *
 * <p>Every move between the three statuses is legal; the reverse moves exist so an admin can
 * correct a mistaken transition. {@code resolvedAt} is set on entering {@link QueryStatus#RESOLVED}
 * and cleared on leaving it, so it is non-null exactly while the query is resolved.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryStatusEngine {

    private static final Map<QueryStatus, Set<QueryStatus>> TRANSITIONS = new EnumMap<>(QueryStatus.class);

    static {
        TRANSITIONS.put(QueryStatus.PENDING, EnumSet.of(QueryStatus.IN_PROGRESS, QueryStatus.RESOLVED));
        TRANSITIONS.put(QueryStatus.IN_PROGRESS, EnumSet.of(QueryStatus.RESOLVED, QueryStatus.PENDING));
        TRANSITIONS.put(QueryStatus.RESOLVED, EnumSet.of(QueryStatus.IN_PROGRESS, QueryStatus.PENDING));
    }

    private final Clock clock;

    public QueryStatus parse(String raw) {
        return QueryStatus.fromValue(raw);
    }

    public Set<QueryStatus> allowedTargets(QueryStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, EnumSet.noneOf(QueryStatus.class)));
    }

    public boolean canTransition(QueryStatus from, QueryStatus to) {
        return allowedTargets(from).contains(to);
    }

    /**
     * Moves the query to {@code target}. Re-applying the current status is a no-op.
     *
     * @return whether the status changed
     */
    public boolean transition(Query query, QueryStatus target) {
        if (target == null) {
            throw new InvalidStatusException("Status is required");
        }
        QueryStatus current = query.getStatus();
        if (current == target) {
            return false;
        }
        if (!canTransition(current, target)) {
            throw new InvalidStatusException("Cannot move query from " + current.getValue() + " to " + target.getValue());
        }

        query.setStatus(target);
        query.setResolvedAt(target == QueryStatus.RESOLVED ? LocalDateTime.now(clock) : null);
        log.info("Query {} moved from {} to {}", query.getId(), current.getValue(), target.getValue());
        return true;
    }

    /**
     * Stores an admin response. Null leaves the response untouched; blank clears it.
     *
     * @return whether a new response was stored
     */
    public boolean respond(Query query, String response) {
        if (response == null) {
            return false;
        }
        String text = response.trim();
        if (text.isEmpty()) {
            query.setAdminResponse(null);
            query.setRespondedAt(null);
            return false;
        }
        if (text.equals(query.getAdminResponse())) {
            return false;
        }
        query.setAdminResponse(text);
        query.setRespondedAt(LocalDateTime.now(clock));
        query.setResponseSeen(false);
        return true;
    }
}
