/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rentlink.config.AdminApiKeyAuthenticationFilter;
import com.rentlink.config.RequestIdFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@Import(ApiErrorHandlingTest.ConstraintTestController.class)
class ApiErrorHandlingTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void dataIntegrityViolationIncludesRequestId() throws Exception {
        HttpHeaders headers = adminHeaders();
        headers.set(RequestIdFilter.HEADER, "test-req-123");
        ResponseEntity<String> res = restTemplate.exchange(
                "/api/admin/test/constraint",
                HttpMethod.POST,
                new HttpEntity<>(headers),
                String.class
        );

        assertEquals(HttpStatus.CONFLICT, res.getStatusCode());

        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertEquals("DATA_INTEGRITY_VIOLATION", body.get("code"));
        assertEquals("test-req-123", body.get("requestId"));
        assertNotNull(body.get("message"));
    }

    @Test
    void illegalArgumentMapsToBadRequest() throws Exception {
        ResponseEntity<String> res = restTemplate.exchange(
                "/api/admin/test/bad-argument",
                HttpMethod.POST,
                new HttpEntity<>(adminHeaders()),
                String.class
        );

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertNotNull(body.get("requestId"));
        assertEquals("sourceId must not be blank", body.get("message"));
    }

    private static HttpHeaders adminHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(AdminApiKeyAuthenticationFilter.HEADER, "test-admin-key");
        return headers;
    }

    @RestController
    @RequestMapping("/api/admin/test")
    static class ConstraintTestController {
        private final JdbcTemplate jdbcTemplate;

        ConstraintTestController(JdbcTemplate jdbcTemplate) {
            this.jdbcTemplate = jdbcTemplate;
        }

        @PostMapping("/constraint")
        public void constraintViolation() {
            String sourceId = "dup-" + UUID.randomUUID();
            for (int i = 0; i < 2; i++) {
                jdbcTemplate.update(
                        """
                        INSERT INTO source_health (
                          id,
                          source_id,
                          updated_at
                        ) VALUES (?, ?, ?)
                        """,
                        UUID.randomUUID().toString(),
                        sourceId,
                        Instant.now().toEpochMilli()
                );
            }
        }

        @PostMapping("/bad-argument")
        public void badArgument() {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
    }
}
