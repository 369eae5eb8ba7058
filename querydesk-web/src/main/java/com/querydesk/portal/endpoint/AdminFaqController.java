package com.querydesk.portal.endpoint;

import com.querydesk.portal.dto.ApiResponse;
import com.querydesk.portal.dto.CreateFaqRequest;
import com.querydesk.portal.dto.FaqAnswerRequest;
import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.service.FaqAggregatorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/faqs")
@RequiredArgsConstructor
public class AdminFaqController {

    private final FaqAggregatorService faqAggregator;

    @GetMapping
    public List<FaqEntry> listFaqs(@RequestParam(required = false) String category) {
        return faqAggregator.listFaqs(category, false);
    }

    @PostMapping
    public ResponseEntity<ApiResponse<FaqEntry>> createFaq(@Valid @RequestBody CreateFaqRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("FAQ added", faqAggregator.createFaq(request)));
    }

    @PutMapping("/{id}")
    public ApiResponse<FaqEntry> setAnswer(@PathVariable Long id, @Valid @RequestBody FaqAnswerRequest request) {
        return ApiResponse.success("FAQ updated", faqAggregator.setAnswer(id, request.getAnswer(), request.getCategory()));
    }

    @PostMapping("/{id}/toggle")
    public ApiResponse<FaqEntry> toggleFaq(@PathVariable Long id) {
        return ApiResponse.success(faqAggregator.toggleActive(id));
    }
}
