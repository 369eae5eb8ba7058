package com.querydesk.portal.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.querydesk.portal.dto.CreateFaqRequest;
import com.querydesk.portal.exception.NotFoundException;
import com.querydesk.portal.exception.ValidationException;
import com.querydesk.portal.model.FaqEntry;
import com.querydesk.portal.model.Query;
import com.querydesk.portal.repository.FaqEntryRepository;
import com.querydesk.portal.repository.QueryRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Folds submitted query messages into FAQ entries and serves the curated FAQ list.
 *
 * <p>Entries are keyed by a SHA-256 hash of the normalized message. The increment-or-create
 * step for a key runs under a lock held for that key until its transaction commits, so two
 * submissions with the same text never both create an entry. The unique constraint on
 * {@code questionKey} covers writers outside this JVM; losing that race falls back to an
 * increment.</p>
 */
@Service
@Slf4j
public class FaqAggregatorService {

    private final FaqEntryRepository faqRepository;
    private final QueryRepository queryRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final boolean caseSensitive;

    // Weak values: a lock lives as long as some thread still holds a reference to it
    private final Cache<String, ReentrantLock> keyLocks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public FaqAggregatorService(FaqEntryRepository faqRepository,
                                QueryRepository queryRepository,
                                PlatformTransactionManager transactionManager,
                                Clock clock,
                                @Value("${app.faq.case-sensitive:false}") boolean caseSensitive) {
        this.faqRepository = faqRepository;
        this.queryRepository = queryRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.caseSensitive = caseSensitive;
    }

    public String normalize(String text) {
        if (text == null) {
            return "";
        }
        String collapsed = text.trim().replaceAll("\\s+", " ");
        return caseSensitive ? collapsed : collapsed.toLowerCase(Locale.ROOT);
    }

    /**
     * The unique lookup key for a question: the hex SHA-256 of its normalized text.
     */
    public String questionKey(String text) {
        return requireKey(text);
    }

    /**
     * Counts one submission of the query's message: increments the matching entry, or creates
     * one with frequency 1 carrying the query's category.
     */
    public FaqEntry recordSubmission(Query query) {
        String key = requireKey(query.getMessage());
        return withKeyLock(key, () -> {
            try {
                return transactionTemplate.execute(status -> incrementOrCreate(key, query));
            } catch (DataIntegrityViolationException e) {
                log.debug("FAQ entry for key '{}' was created concurrently, incrementing instead", key);
                return transactionTemplate.execute(status -> {
                    faqRepository.incrementFrequency(key);
                    return faqRepository.findByQuestionKey(key).orElseThrow(() -> e);
                });
            }
        });
    }

    private FaqEntry incrementOrCreate(String key, Query query) {
        if (faqRepository.incrementFrequency(key) > 0) {
            FaqEntry existing = faqRepository.findByQuestionKey(key)
                    .orElseThrow(() -> new IllegalStateException("FAQ entry vanished for key " + key));
            log.debug("FAQ {} frequency now {}", existing.getId(), existing.getFrequency());
            return existing;
        }

        FaqEntry created = FaqEntry.builder()
                .question(query.getMessage().trim())
                .questionKey(key)
                .answer(null)
                .category(query.getCategory())
                .frequency(1)
                .active(true)
                .sourceQueryId(query.getId())
                .createdAt(LocalDateTime.now(clock))
                .build();
        FaqEntry saved = faqRepository.saveAndFlush(created);
        log.info("Created FAQ {} from query {}", saved.getId(), query.getId());
        return saved;
    }

    public List<FaqEntry> listFaqs(String category, boolean activeOnly) {
        boolean byCategory = category != null && !category.isBlank();
        if (activeOnly) {
            return byCategory
                    ? faqRepository.findByActiveTrueAndCategoryIgnoreCaseOrderByFrequencyDescIdAsc(category.trim())
                    : faqRepository.findByActiveTrueOrderByFrequencyDescIdAsc();
        }
        return byCategory
                ? faqRepository.findByCategoryIgnoreCaseOrderByFrequencyDescIdAsc(category.trim())
                : faqRepository.findAllByOrderByFrequencyDescIdAsc();
    }

    public FaqEntry getFaq(Long id) {
        return faqRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("FAQ not found: " + id));
    }

    /**
     * Updates the curated answer (blank clears it) and, when given, the category. Frequency is
     * never touched here.
     */
    @Transactional
    public FaqEntry setAnswer(Long id, String answer, String category) {
        FaqEntry faq = getFaq(id);
        faq.setAnswer(answer == null || answer.isBlank() ? null : answer.trim());
        if (category != null) {
            faq.setCategory(category.isBlank() ? null : category.trim());
        }
        return faqRepository.save(faq);
    }

    @Transactional
    public FaqEntry toggleActive(Long id) {
        FaqEntry faq = getFaq(id);
        faq.setActive(!faq.isActive());
        log.info("FAQ {} is now {}", id, faq.isActive() ? "active" : "inactive");
        return faqRepository.save(faq);
    }

    public FaqEntry createFaq(CreateFaqRequest request) {
        String key = requireKey(request.getQuestion());
        return withKeyLock(key, () -> transactionTemplate.execute(status -> {
            if (faqRepository.existsByQuestionKey(key)) {
                throw new ValidationException("An FAQ with this question already exists");
            }
            FaqEntry faq = FaqEntry.builder()
                    .question(request.getQuestion().trim())
                    .questionKey(key)
                    .answer(blankToNull(request.getAnswer()))
                    .category(blankToNull(request.getCategory()))
                    .frequency(1)
                    .active(true)
                    .createdAt(LocalDateTime.now(clock))
                    .build();
            return faqRepository.saveAndFlush(faq);
        }));
    }

    /**
     * Publishes a query as an FAQ: the matching entry is activated, linked to the query and, if it
     * has no answer yet, answered with the query's admin response.
     */
    public FaqEntry promoteQuery(Long queryId) {
        Query query = queryRepository.findById(queryId)
                .orElseThrow(() -> new NotFoundException("Query not found: " + queryId));
        String key = requireKey(query.getMessage());

        return withKeyLock(key, () -> transactionTemplate.execute(status -> {
            FaqEntry faq = faqRepository.findByQuestionKey(key)
                    .orElseGet(() -> FaqEntry.builder()
                            .question(query.getMessage().trim())
                            .questionKey(key)
                            .category(query.getCategory())
                            .frequency(1)
                            .createdAt(LocalDateTime.now(clock))
                            .build());
            if (faq.getAnswer() == null && query.getAdminResponse() != null) {
                faq.setAnswer(query.getAdminResponse());
            }
            if (faq.getSourceQueryId() == null) {
                faq.setSourceQueryId(query.getId());
            }
            faq.setActive(true);
            return faqRepository.saveAndFlush(faq);
        }));
    }

    private <T> T withKeyLock(String key, Supplier<T> work) {
        ReentrantLock lock = keyLocks.get(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private String requireKey(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            throw new ValidationException("Question text is required");
        }
        return DigestUtils.sha256Hex(normalized);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
