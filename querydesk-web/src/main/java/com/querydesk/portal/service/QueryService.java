package com.querydesk.portal.service;

import com.querydesk.portal.dto.PageResult;
import com.querydesk.portal.dto.QueryFilter;
import com.querydesk.portal.dto.QueryUpdateRequest;
import com.querydesk.portal.dto.QueryUpdateResult;
import com.querydesk.portal.dto.SubmitQueryRequest;
import com.querydesk.portal.event.QueryRespondedEvent;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import com.querydesk.portal.repository.QueryRepository;
import com.querydesk.portal.repository.QuerySpecifications;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

/**
 * Query store operations: intake, lookup, filtered listing, admin updates and deletes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

    static final int MAX_MESSAGE_LENGTH = 5000;

    private static final Set<String> SORTABLE_FIELDS = Set.of("createdAt", "status", "category", "id");

    private final QueryRepository queryRepository;
    private final QueryStatusEngine statusEngine;
    private final FaqAggregatorService faqAggregator;
    private final BlocklistService blocklistService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${app.query.max-page-size:100}")
    private int maxPageSize = 100;

    public Query submit(SubmitQueryRequest request, String requesterIdentity) {
        Query draft = Query.builder()
                .requesterName(request.getName())
                .requesterEmail(request.getEmail())
                .requesterIdentity(requesterIdentity)
                .category(request.getCategory())
                .message(request.getMessage())
                .build();
        return create(draft);
    }

    /**
     * Stores a new query, then offers its message to the FAQ aggregator.
     *
     * <p>Only the identity fields of {@code draft} are read; id, timestamps, status and response
     * are assigned here. Aggregation is best effort: once the query is stored, an aggregation
     * failure is logged and the stored query is still returned.</p>
     */
    public Query create(Query draft) {
        String name = trimToNull(draft.getRequesterName());
        String email = trimToNull(draft.getRequesterEmail());
        String message = trimToNull(draft.getMessage());
        if (name == null || email == null || message == null) {
            throw new ValidationException("Name, email and message are required");
        }
        if (message.length() > MAX_MESSAGE_LENGTH) {
            throw new ValidationException("Message must be at most " + MAX_MESSAGE_LENGTH + " characters");
        }
        String identity = trimToNull(draft.getRequesterIdentity());
        blocklistService.ensureMaySubmit(identity, email);

        Query query = Query.builder()
                .requesterName(name)
                .requesterEmail(email)
                .requesterIdentity(identity)
                .category(trimToNull(draft.getCategory()))
                .message(message)
                .status(QueryStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
        Query saved = queryRepository.save(query);
        log.info("Query {} submitted by {} ({})", saved.getId(), email, identity != null ? identity : "guest");

        try {
            faqAggregator.recordSubmission(saved);
        } catch (RuntimeException e) {
            log.warn("FAQ aggregation failed for query {}: {}", saved.getId(), e.getMessage(), e);
        }
        return saved;
    }

    public Query get(Long id) {
        return queryRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Query not found: " + id));
    }

    public PageResult<Query> list(QueryFilter filter, int page, int limit, String sortField, String direction) {
        if (page < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (limit < 1) {
            throw new ValidationException("limit must be at least 1");
        }
        int size = Math.min(limit, maxPageSize);
        QueryFilter effective = filter != null ? filter : QueryFilter.none();

        Specification<Query> spec = Specification.where(QuerySpecifications.hasStatus(effective.status()))
                .and(QuerySpecifications.hasCategory(effective.category()))
                .and(QuerySpecifications.containsText(effective.searchText()));

        Page<Query> result = queryRepository.findAll(spec, PageRequest.of(page - 1, size, sort(sortField, direction)));
        return new PageResult<>(result.getContent(), page, size, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional
    public QueryUpdateResult update(Long id, QueryUpdateRequest request) {
        QueryStatus target = request.getStatus() != null ? statusEngine.parse(request.getStatus()) : null;
        Query query = get(id);

        if (target != null) {
            statusEngine.transition(query, target);
        }
        boolean responded = statusEngine.respond(query, request.getAdminResponse());

        Query saved = queryRepository.save(query);
        if (responded) {
            log.info("Admin responded to query {}", saved.getId());
            eventPublisher.publishEvent(QueryRespondedEvent.from(saved));
        }
        return new QueryUpdateResult(saved, responded);
    }

    @Transactional
    public void delete(Long id) {
        if (!queryRepository.existsById(id)) {
            throw new NotFoundException("Query not found: " + id);
        }
        queryRepository.deleteById(id);
        log.info("Query {} deleted", id);
    }

    /**
     * Looks up queries by student identity, or by email for guest submissions only. A student's
     * queries are never returned for an email lookup.
     */
    public List<Query> listByRequester(String requesterIdentity, String requesterEmail) {
        if (requesterIdentity != null && !requesterIdentity.isBlank()) {
            return queryRepository.findByRequesterIdentityOrderByCreatedAtDesc(requesterIdentity.trim());
        }
        if (requesterEmail != null && !requesterEmail.isBlank()) {
            return queryRepository.findByRequesterIdentityIsNullAndRequesterEmailIgnoreCaseOrderByCreatedAtDesc(
                    requesterEmail.trim());
        }
        throw new ValidationException("A requester identity or email is required");
    }

    /**
     * Lists a student's own queries and marks their unseen replies as seen. The returned records
     * still carry the pre-call {@code responseSeen} flags, so callers can highlight new replies.
     */
    @Transactional
    public List<Query> listForStudent(String studentId) {
        List<Query> queries = listByRequester(studentId, null);
        int seen = queryRepository.markRepliesSeen(studentId);
        if (seen > 0) {
            log.debug("Marked {} replies as seen for {}", seen, studentId);
        }
        return queries;
    }

    private Sort sort(String sortField, String direction) {
        if (sortField != null && !SORTABLE_FIELDS.contains(sortField)) {
            throw new ValidationException("Cannot sort by " + sortField);
        }
        String field = sortField != null ? sortField : "createdAt";
        Sort.Direction dir = "asc".equalsIgnoreCase(direction) ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(dir, field);
        return "id".equals(field) ? sort : sort.and(Sort.by(dir, "id"));
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
