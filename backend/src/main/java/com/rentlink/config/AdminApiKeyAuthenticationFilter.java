/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Grants ROLE_ADMIN to requests carrying the configured operator key. The optional
 * {@code X-Admin-Actor} header names the operator in reset audit fields.
 */
@Component
public class AdminApiKeyAuthenticationFilter extends OncePerRequestFilter {
    public static final String HEADER = "X-Admin-Api-Key";
    public static final String ACTOR_HEADER = "X-Admin-Actor";
    public static final String DEFAULT_ACTOR = "admin";

    private final AppProperties appProperties;

    public AdminApiKeyAuthenticationFilter(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !(path.startsWith("/api/admin") || path.startsWith("/actuator"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String expected = appProperties.admin().apiKey();
        String presented = request.getHeader(HEADER);
        if (matches(expected, presented)) {
            String actor = request.getHeader(ACTOR_HEADER);
            if (actor == null || actor.isBlank()) {
                actor = DEFAULT_ACTOR;
            }
            var auth = new UsernamePasswordAuthenticationToken(
                    actor,
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_ADMIN"))
            );
            SecurityContextHolder.getContext().setAuthentication(auth);
        }
        filterChain.doFilter(request, response);
    }

    private static boolean matches(String expected, String presented) {
        if (expected == null || expected.isBlank() || presented == null || presented.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                presented.getBytes(StandardCharsets.UTF_8)
        );
    }
}
