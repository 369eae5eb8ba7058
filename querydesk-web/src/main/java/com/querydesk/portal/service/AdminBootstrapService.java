package com.querydesk.portal.service;

import com.querydesk.portal.model.Admin;
import com.querydesk.portal.repository.AdminRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Seeds the configured admin account once at startup. Re-running is harmless: an existing
 * account with the configured username is left as it is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminBootstrapService {

    private final AdminRepository adminRepository;
    private final PasswordEncoder passwordEncoder;

    @Value("${app.admin.bootstrap.enabled:true}")
    private boolean enabled = true;

    @Value("${app.admin.bootstrap.username:admin}")
    private String username = "admin";

    @Value("${app.admin.bootstrap.password:}")
    private String password = "";

    @Value("${app.admin.bootstrap.email:admin@example.com}")
    private String email = "admin@example.com";

    @Value("${app.admin.bootstrap.full-name:Administrator}")
    private String fullName = "Administrator";

    @PostConstruct
    public void init() {
        ensureDefaultAdmin();
    }

    /**
     * @return whether an admin was created
     */
    public boolean ensureDefaultAdmin() {
        if (!enabled) {
            log.info("Admin bootstrap disabled");
            return false;
        }
        if (password == null || password.isBlank()) {
            log.warn("Admin bootstrap skipped: no password configured for '{}'", username);
            return false;
        }
        if (adminRepository.existsByUsername(username)) {
            log.debug("Admin '{}' already exists, bootstrap skipped", username);
            return false;
        }

        Admin admin = Admin.builder()
                .username(username)
                .passwordHash(passwordEncoder.encode(password))
                .email(email)
                .fullName(fullName)
                .active(true)
                .build();
        adminRepository.save(admin);
        log.info("Default admin '{}' created", username);
        return true;
    }
}
