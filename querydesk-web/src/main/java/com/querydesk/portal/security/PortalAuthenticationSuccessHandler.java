package com.querydesk.portal.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.querydesk.portal.util.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.authentication.AuthenticationSuccessHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.Set;

/**
 * Answers a successful form login with the caller's role and the dashboard it should open.
 */
@Component
public class PortalAuthenticationSuccessHandler implements AuthenticationSuccessHandler {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public void onAuthenticationSuccess(HttpServletRequest request, HttpServletResponse response,
                                        Authentication authentication) throws IOException {
        Set<String> roles = AuthorityUtils.authorityListToSet(authentication.getAuthorities());
        boolean admin = roles.contains(SecurityUtils.ROLE_ADMIN);

        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of(
                "success", true,
                "username", authentication.getName(),
                "role", admin ? "ADMIN" : "STUDENT",
                "redirect", admin ? "/admin/dashboard" : "/student/dashboard"));
    }
}
