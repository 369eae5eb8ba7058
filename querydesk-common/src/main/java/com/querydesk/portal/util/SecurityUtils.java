package com.querydesk.portal.util;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;

import java.security.Principal;

public final class SecurityUtils {

    public static final String ROLE_ADMIN = "ROLE_ADMIN";
    public static final String ROLE_STUDENT = "ROLE_STUDENT";

    private SecurityUtils() {
    }

    public static String getUsername(Principal principal) {
        return principal != null ? principal.getName() : null;
    }

    public static boolean hasRole(Principal principal, String role) {
        if (principal instanceof Authentication) {
            Authentication authentication = (Authentication) principal;
            return authentication.isAuthenticated()
                    && AuthorityUtils.authorityListToSet(authentication.getAuthorities()).contains(role);
        }
        return false;
    }

    public static boolean isAdmin(Principal principal) {
        return hasRole(principal, ROLE_ADMIN);
    }

    public static boolean isStudent(Principal principal) {
        return hasRole(principal, ROLE_STUDENT);
    }
}
