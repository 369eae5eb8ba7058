package com.querydesk.portal.config;

import io.github.bucket4j.Bandwidth;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Value("${rate-limiter.submissions.capacity:10}")
    private long capacity;

    @Value("${rate-limiter.submissions.window:PT1M}")
    private Duration window;

    // Per-client limit applied to query submissions
    @Bean(name = "submissionBandwidth")
    public Bandwidth submissionBandwidth() {
        return Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, window)
                .build();
    }
}
