package com.querydesk.portal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class PortalConfig {

    // Timestamps are stored as UTC wall-clock time
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
