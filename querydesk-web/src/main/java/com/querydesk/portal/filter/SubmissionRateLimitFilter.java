package com.querydesk.portal.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.querydesk.portal.exception.GlobalExceptionHandler;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Component
@Order(1)
@Slf4j
public class SubmissionRateLimitFilter extends OncePerRequestFilter {

    static final String SUBMISSION_PATH = "/api/queries";

    private final Bandwidth bandwidth;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Cache<String, Bucket> buckets = Caffeine.newBuilder()
            .expireAfterAccess(1, TimeUnit.HOURS)
            .maximumSize(100_000)
            .build();

    public SubmissionRateLimitFilter(@Qualifier("submissionBandwidth") Bandwidth bandwidth) {
        this.bandwidth = bandwidth;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !("POST".equalsIgnoreCase(request.getMethod())
                && SUBMISSION_PATH.equals(request.getRequestURI()));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String client = clientKey(request);
        Bucket bucket = buckets.get(client, key -> Bucket.builder().addLimit(bandwidth).build());

        if (!bucket.tryConsume(1)) {
            log.warn("Submission rate limit exceeded for {}", client);
            response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            objectMapper.writeValue(response.getOutputStream(),
                    GlobalExceptionHandler.errorBody("RateLimited", "Too many submissions, please try again later"));
            return;
        }

        filterChain.doFilter(request, response);
    }

    // Proxy headers are only honoured through server.forward-headers-strategy
    private String clientKey(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
