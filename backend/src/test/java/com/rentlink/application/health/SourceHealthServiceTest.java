/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.domain.model.CompanyType;
import com.rentlink.domain.model.SourceHealthStatus;
import com.rentlink.infrastructure.persistence.entity.CompanyEntity;
import com.rentlink.infrastructure.persistence.entity.SourceHealthEntity;
import com.rentlink.infrastructure.persistence.repository.CompanyRepository;
import com.rentlink.infrastructure.persistence.repository.SourceHealthRepository;
import com.rentlink.support.MutableClock;
import com.rentlink.support.TestClockConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class SourceHealthServiceTest {
    private static final long SLOW = 3500;
    private static final long FAST = 500;

    @Autowired
    private SourceHealthService service;

    @Autowired
    private SourceMetricDispatcher dispatcher;

    @Autowired
    private SourceHealthRepository repository;

    @Autowired
    private CompanyRepository companyRepository;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock.set(TestClockConfig.T0);
        repository.deleteAll();
        companyRepository.deleteAll();
    }

    @Test
    void fastSamplesNeverStrike() throws Exception {
        record("S-fast", FAST, FAST, FAST, 3000);

        SourceHealthSnapshot health = service.getSourceHealth("S-fast");
        assertEquals(4, health.sampleCount());
        assertEquals(0, health.slowCount());
        assertEquals(0, health.strikeCount());
        assertEquals(0.0, health.slowRate());
        assertTrue(health.healthy());
        assertFalse(service.isSourceExcluded("S-fast"));
    }

    @Test
    void thirdConsecutiveSlowSampleExcludesUntilAFastOne() throws Exception {
        record("S1", SLOW, SLOW);
        assertFalse(service.isSourceExcluded("S1"));
        assertEquals(2, service.getSourceHealth("S1").strikeCount());

        record("S1", SLOW);
        SourceHealthSnapshot excluded = service.getSourceHealth("S1");
        assertEquals(1, excluded.backoffLevel());
        assertEquals(0, excluded.strikeCount());
        assertEquals(TestClockConfig.T0.plus(Duration.ofMinutes(15)), excluded.excludedUntil());
        assertFalse(excluded.healthy());
        assertTrue(service.isSourceExcluded("S1"));

        record("S1", FAST);
        SourceHealthSnapshot recovered = service.getSourceHealth("S1");
        assertFalse(service.isSourceExcluded("S1"));
        assertEquals(0, recovered.backoffLevel());
        assertNull(recovered.excludedUntil());
        assertEquals(4, recovered.sampleCount());
        assertEquals(3, recovered.slowCount());
        assertEquals(0.75, recovered.slowRate());
    }

    @Test
    void expiredExclusionIsClearedOnCheck() throws Exception {
        record("S-expiry", SLOW, SLOW, SLOW);
        assertTrue(service.isSourceExcluded("S-expiry"));

        clock.advance(Duration.ofMinutes(16));

        assertFalse(service.isSourceExcluded("S-expiry"));
        SourceHealthEntity row = repository.findBySourceId("S-expiry").orElseThrow();
        assertNull(row.getExcludedUntil());
        assertEquals(1, row.getBackoffLevel());
    }

    @Test
    void slowSamplesWhileExcludedEscalateUpToTheLastRung() throws Exception {
        record("S-ladder", SLOW, SLOW, SLOW);
        record("S-ladder", SLOW, SLOW, SLOW);
        SourceHealthSnapshot second = service.getSourceHealth("S-ladder");
        assertEquals(2, second.backoffLevel());
        assertEquals(TestClockConfig.T0.plus(Duration.ofMinutes(30)), second.excludedUntil());

        for (int i = 0; i < 5; i++) {
            record("S-ladder", SLOW, SLOW, SLOW);
        }
        SourceHealthSnapshot capped = service.getSourceHealth("S-ladder");
        assertEquals(5, capped.backoffLevel());
        assertEquals(TestClockConfig.T0.plus(Duration.ofHours(4)), capped.excludedUntil());
    }

    @Test
    void reexclusionAfterExpiryStartsAtFirstRung() throws Exception {
        record("S-again", SLOW, SLOW, SLOW);
        record("S-again", SLOW, SLOW, SLOW);
        clock.advance(Duration.ofHours(1));

        record("S-again", SLOW, SLOW, SLOW);

        SourceHealthSnapshot health = service.getSourceHealth("S-again");
        assertEquals(1, health.backoffLevel());
        assertEquals(clock.instant().plus(Duration.ofMinutes(15)), health.excludedUntil());
    }

    @Test
    void readingUnknownSourceDoesNotCreateRow() {
        SourceHealthSnapshot health = service.getSourceHealth("never-seen");

        assertTrue(health.healthy());
        assertEquals(0, health.sampleCount());
        assertNull(health.excludedUntil());
        assertFalse(service.isSourceExcluded("never-seen"));
        assertTrue(repository.findBySourceId("never-seen").isEmpty());
    }

    @Test
    void resetReturnsSourceToZeroStateAndIsIdempotent() throws Exception {
        record("S-reset", SLOW, SLOW, SLOW, SLOW);
        assertTrue(service.isSourceExcluded("S-reset"));

        service.resetSourceHealth("S-reset", "ops@rentlink");
        SourceHealthSnapshot first = service.getSourceHealth("S-reset");
        service.resetSourceHealth("S-reset", "ops@rentlink");
        SourceHealthSnapshot second = service.getSourceHealth("S-reset");

        assertFalse(service.isSourceExcluded("S-reset"));
        for (SourceHealthSnapshot health : List.of(first, second)) {
            assertEquals(0, health.sampleCount());
            assertEquals(0, health.slowCount());
            assertEquals(0, health.strikeCount());
            assertEquals(0, health.backoffLevel());
            assertNull(health.excludedUntil());
            assertNull(health.lastStrikeAt());
            assertEquals("ops@rentlink", health.lastResetBy());
            assertEquals(TestClockConfig.T0, health.lastResetAt());
            assertTrue(health.healthy());
        }
    }

    @Test
    void resetCreatesRowForSourceWithoutHistory() {
        service.resetSourceHealth("S-new", null);

        SourceHealthEntity row = repository.findBySourceId("S-new").orElseThrow();
        assertEquals(0, row.getSampleCount());
        assertNull(row.getLastResetBy());
        assertNotNull(row.getLastResetAt());
    }

    @Test
    void listingLabelsEachSourceAndNamesItsCompany() throws Exception {
        saveCompany("S-excl", "Excluded Cars", CompanyType.SOURCE);
        saveCompany("S-slow", "Slow Cars", CompanyType.SOURCE);

        record("S-excl", SLOW, SLOW, SLOW);
        clock.advance(Duration.ofSeconds(1));
        record("S-slow", SLOW, SLOW, FAST);
        clock.advance(Duration.ofSeconds(1));
        record("S-ok", FAST);

        List<SourceHealthListing> listing = service.getAllSourceHealth();

        assertEquals(List.of("S-ok", "S-slow", "S-excl"),
                listing.stream().map(SourceHealthListing::sourceId).toList());
        Map<String, SourceHealthListing> byId = listing.stream()
                .collect(Collectors.toMap(SourceHealthListing::sourceId, Function.identity()));

        assertEquals(SourceHealthStatus.EXCLUDED, byId.get("S-excl").status());
        assertEquals("Excluded Cars", byId.get("S-excl").companyName());
        assertFalse(byId.get("S-excl").healthy());

        assertEquals(SourceHealthStatus.SLOW, byId.get("S-slow").status());
        assertEquals("Slow Cars", byId.get("S-slow").companyName());
        assertTrue(byId.get("S-slow").healthy());

        assertEquals(SourceHealthStatus.HEALTHY, byId.get("S-ok").status());
        assertEquals(SourceHealthService.UNKNOWN_COMPANY, byId.get("S-ok").companyName());
    }

    @Test
    void resetAllCoversEverySourceCompany() throws Exception {
        saveCompany("S-a", "Source A", CompanyType.SOURCE);
        saveCompany("S-b", "Source B", CompanyType.SOURCE);
        saveCompany("A-1", "Agent One", CompanyType.AGENT);
        record("S-a", SLOW, SLOW, SLOW);

        int count = service.resetAllSourceHealth("ops");

        assertEquals(2, count);
        assertFalse(service.isSourceExcluded("S-a"));
        assertEquals("ops", service.getSourceHealth("S-b").lastResetBy());
        assertTrue(repository.findBySourceId("A-1").isEmpty());
    }

    @Test
    void exclusionIsCountedAndStatusGaugeFollowsHealth() throws Exception {
        String sourceId = "S-metrics-" + UUID.randomUUID();

        record(sourceId, SLOW, SLOW, SLOW);

        Counter exclusions = meterRegistry.get(SourceHealthMetrics.EXCLUSION_TOTAL)
                .tag("source_id", sourceId)
                .tag("reason", "strikes")
                .counter();
        assertEquals(1.0, exclusions.count());
        assertEquals(0.0, gauge(sourceId));

        record(sourceId, FAST);
        assertEquals(1.0, gauge(sourceId));
        assertEquals(1.0, exclusions.count());
    }

    private double gauge(String sourceId) {
        return meterRegistry.get(SourceHealthMetrics.HEALTH_STATUS).tag("source_id", sourceId).gauge().value();
    }

    private void saveCompany(String id, String name, CompanyType type) {
        CompanyEntity company = new CompanyEntity();
        company.setId(id);
        company.setCompanyName(name);
        company.setType(type);
        companyRepository.save(company);
    }

    private void record(String sourceId, long... latencies) throws InterruptedException {
        for (long latency : latencies) {
            service.recordMetric(sourceId, latency, true);
            assertTrue(dispatcher.awaitIdle(Duration.ofSeconds(5)));
        }
    }
}
