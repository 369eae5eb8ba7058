package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.ApiResponse;
import com.querydesk.portal.dto.SubmissionReceipt;
import com.querydesk.portal.dto.SubmitQueryRequest;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.service.QueryService;
import com.querydesk.portal.util.SecurityUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

@RestController
@RequestMapping("/api/queries")
@RequiredArgsConstructor
public class QueryController {

    private final QueryService queryService;

    @PostMapping
    public ResponseEntity<ApiResponse<SubmissionReceipt>> submitQuery(@Valid @RequestBody SubmitQueryRequest request,
                                                                      Principal principal) {
        // Logged-in students are linked to their account, everyone else is a guest
        String identity = SecurityUtils.isStudent(principal) ? SecurityUtils.getUsername(principal) : null;
        Query query = queryService.submit(request, identity);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Your query has been submitted successfully.",
                        new SubmissionReceipt(query.getId(), query.getStatus())));
    }

    @GetMapping("/lookup")
    public List<Query> lookupByEmail(@RequestParam String email) {
        return queryService.listByRequester(null, email);
    }

    @GetMapping("/mine")
    public ResponseEntity<?> myQueries(Principal principal) {
        if (principal == null) return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        return ResponseEntity.ok(queryService.listForStudent(SecurityUtils.getUsername(principal)));
    }
}
