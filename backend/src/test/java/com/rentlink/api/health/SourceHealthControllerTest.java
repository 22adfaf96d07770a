/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.api.health;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rentlink.config.SourceApiKeyAuthenticationFilter;
import com.rentlink.domain.model.CompanyType;
import com.rentlink.infrastructure.crypto.Sha256;
import com.rentlink.infrastructure.persistence.entity.CompanyEntity;
import com.rentlink.infrastructure.persistence.repository.CompanyRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class SourceHealthControllerTest {
    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private CompanyRepository companyRepository;

    @BeforeEach
    void setUp() {
        companyRepository.deleteAll();
        CompanyEntity source = new CompanyEntity();
        source.setId("SRC-self");
        source.setCompanyName("Self Check Rentals");
        source.setType(CompanyType.SOURCE);
        source.setApiKeyHash(Sha256.hex("src-key"));
        companyRepository.save(source);
        CompanyEntity agent = new CompanyEntity();
        agent.setId("AGT-self");
        agent.setCompanyName("Agent Desk");
        agent.setType(CompanyType.AGENT);
        agent.setApiKeyHash(Sha256.hex("agent-key"));
        companyRepository.save(agent);
    }

    @Test
    void sourceReadsItsOwnHealth() throws Exception {
        ResponseEntity<String> res = get("src-key");

        assertEquals(HttpStatus.OK, res.getStatusCode());
        Map<String, Object> body = objectMapper.readValue(res.getBody(), new TypeReference<>() {});
        assertEquals("SRC-self", body.get("sourceId"));
        assertEquals(true, body.get("healthy"));
    }

    @Test
    void agentKeysAndMissingKeysAreRejected() {
        assertEquals(HttpStatus.UNAUTHORIZED, get("agent-key").getStatusCode());
        assertEquals(HttpStatus.UNAUTHORIZED, get(null).getStatusCode());
    }

    private ResponseEntity<String> get(String apiKey) {
        HttpHeaders headers = new HttpHeaders();
        if (apiKey != null) {
            headers.set(SourceApiKeyAuthenticationFilter.HEADER, apiKey);
        }
        return restTemplate.exchange("/api/health/my-source", HttpMethod.GET, new HttpEntity<>(headers), String.class);
    }
}
