package com.querydesk.portal.config;

import com.querydesk.portal.security.ForbiddenResponseHandler;
import com.querydesk.portal.security.PortalAuthenticationSuccessHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;

@Configuration
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http,
                                           PortalAuthenticationSuccessHandler successHandler,
                                           ForbiddenResponseHandler forbiddenHandler) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .authorizeHttpRequests(auth -> auth
                        // 1. PUBLIC: intake, guest status view, FAQ page, signup
                        .requestMatchers("/", "/error", "/login", "/api/auth/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/api/queries").permitAll()
                        .requestMatchers(HttpMethod.GET, "/api/queries/lookup", "/api/faqs").permitAll()

                        // 2. ADMIN
                        .requestMatchers("/api/admin/**").hasRole("ADMIN")

                        // 3. STUDENT
                        .requestMatchers("/api/queries/mine").hasRole("STUDENT")

                        // 4. CATCH-ALL
                        .anyRequest().authenticated()
                )
                .formLogin(form -> form
                        .loginProcessingUrl("/login")
                        .successHandler(successHandler)
                        .failureHandler((request, response, exception) ->
                                response.sendError(HttpStatus.UNAUTHORIZED.value(), "Invalid credentials"))
                        .permitAll()
                )
                .logout(logout -> logout
                        .logoutUrl("/logout")
                        .logoutSuccessHandler(new HttpStatusReturningLogoutSuccessHandler(HttpStatus.OK))
                        .permitAll()
                )
                .exceptionHandling(e -> e
                        .authenticationEntryPoint(forbiddenHandler)
                        .accessDeniedHandler(forbiddenHandler)
                );

        return http.build();
    }
}
