package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.ApiResponse;
import com.querydesk.portal.dto.PageResult;
import com.querydesk.portal.dto.QueryFilter;
import com.querydesk.portal.dto.QueryUpdateRequest;
import com.querydesk.portal.dto.QueryUpdateResult;
import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.model.QueryStatus;
import com.querydesk.portal.service.FaqAggregatorService;
import com.querydesk.portal.service.QueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/queries")
@RequiredArgsConstructor
public class AdminQueryController {

    private final QueryService queryService;
    private final FaqAggregatorService faqAggregator;

    @GetMapping
    public PageResult<Query> listQueries(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String sort,
            @RequestParam(defaultValue = "desc") String direction) {
        QueryStatus statusFilter = status != null && !status.isBlank() ? QueryStatus.fromValue(status) : null;
        return queryService.list(new QueryFilter(statusFilter, category, search), page, limit, sort, direction);
    }

    @GetMapping("/{id}")
    public Query getQuery(@PathVariable Long id) {
        return queryService.get(id);
    }

    @PatchMapping("/{id}")
    public ApiResponse<QueryUpdateResult> updateQuery(@PathVariable Long id, @RequestBody QueryUpdateRequest request) {
        return ApiResponse.success("Query updated", queryService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteQuery(@PathVariable Long id) {
        queryService.delete(id);
        return ResponseEntity.ok(ApiResponse.success("Query deleted", null));
    }

    @PostMapping("/{id}/faq")
    public ApiResponse<FaqEntry> promoteToFaq(@PathVariable Long id) {
        return ApiResponse.success("Query added to FAQs", faqAggregator.promoteQuery(id));
    }
}
