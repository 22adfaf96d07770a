/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rentlink.api.ApiErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {
    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(
            HttpServletRequest request,
            HttpServletResponse response,
            AuthenticationException authException
    ) throws IOException {
        String requestId = MDC.get(RequestIdFilter.MDC_KEY);
        String path = request.getRequestURI();
        String message;
        if (path != null && path.startsWith("/api/admin")) {
            message = "Missing/Invalid " + AdminApiKeyAuthenticationFilter.HEADER;
        } else if (path != null && path.startsWith("/api/health")) {
            message = "Missing/Invalid " + SourceApiKeyAuthenticationFilter.HEADER;
        } else {
            message = "Unauthorized";
        }

        ApiErrorResponse body = new ApiErrorResponse("UNAUTHORIZED", "UNAUTHORIZED", message, requestId == null ? "" : requestId);
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
