package com.querydesk.portal.endpoint;

import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.service.FaqAggregatorService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/faqs")
@RequiredArgsConstructor
public class FaqController {

    private final FaqAggregatorService faqAggregator;

    @GetMapping
    public List<FaqEntry> publicFaqs(@RequestParam(required = false) String category) {
        return faqAggregator.listFaqs(category, true);
    }
}
