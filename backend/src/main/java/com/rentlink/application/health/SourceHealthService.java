/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.application.health.policy.BackoffPolicy;
import com.rentlink.config.HealthMonitorProperties;
import com.rentlink.domain.model.CompanyType;
import com.rentlink.domain.model.HealthCounters;
import com.rentlink.domain.model.SourceHealthStatus;
import com.rentlink.infrastructure.persistence.entity.CompanyEntity;
import com.rentlink.infrastructure.persistence.entity.SourceHealthEntity;
import com.rentlink.infrastructure.persistence.repository.CompanyRepository;
import com.rentlink.infrastructure.persistence.repository.SourceHealthRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for everything that touches Source health: metric ingestion, the exclusion gate
 * used by routing, and the operator queries and resets.
 */
@Service
public class SourceHealthService implements SourceExclusionGate {
    private static final Logger log = LoggerFactory.getLogger(SourceHealthService.class);

    static final String UNKNOWN_COMPANY = "Unknown";

    private final HealthMonitorProperties properties;
    private final SourceMetricDispatcher dispatcher;
    private final SourceHealthRecorder recorder;
    private final SourceHealthRepository repository;
    private final CompanyRepository companyRepository;
    private final BackoffPolicy backoffPolicy;
    private final SourceHealthMetrics metrics;
    private final Clock clock;

    public SourceHealthService(
            HealthMonitorProperties properties,
            SourceMetricDispatcher dispatcher,
            SourceHealthRecorder recorder,
            SourceHealthRepository repository,
            CompanyRepository companyRepository,
            BackoffPolicy backoffPolicy,
            SourceHealthMetrics metrics,
            Clock clock
    ) {
        this.properties = properties;
        this.dispatcher = dispatcher;
        this.recorder = recorder;
        this.repository = repository;
        this.companyRepository = companyRepository;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Queues one upstream call observation. Returns immediately and never throws.
     */
    public void recordMetric(String sourceId, long latencyMs, boolean success) {
        if (!properties.enabled()) return;
        if (sourceId == null || sourceId.isBlank()) {
            log.debug("Ignoring health metric without sourceId latencyMs={}", latencyMs);
            return;
        }
        try {
            dispatcher.submit(new HealthSample(sourceId, latencyMs, success));
        } catch (RuntimeException e) {
            log.error("Failed to queue health metric sourceId={}", sourceId, e);
        }
    }

    /**
     * Fails open: a lookup error is logged and reported as "not excluded".
     */
    @Override
    public boolean isSourceExcluded(String sourceId) {
        if (!properties.enabled()) return false;
        try {
            Optional<SourceHealthEntity> health = repository.findBySourceId(sourceId);
            if (health.isEmpty() || health.get().getExcludedUntil() == null) {
                return false;
            }
            if (health.get().getExcludedUntil().isAfter(clock.instant())) {
                return true;
            }
            if (recorder.clearExpiredExclusion(sourceId)) {
                log.debug("Cleared expired exclusion sourceId={}", sourceId);
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Failed to check source exclusion sourceId={}", sourceId, e);
            return false;
        }
    }

    /**
     * Never creates a row; an unknown Source reads as healthy with no samples.
     */
    public SourceHealthSnapshot getSourceHealth(String sourceId) {
        try {
            return repository.findBySourceId(sourceId)
                    .map(this::toSnapshot)
                    .orElseGet(() -> SourceHealthSnapshot.unknown(sourceId));
        } catch (RuntimeException e) {
            log.error("Failed to get source health sourceId={}", sourceId, e);
            return SourceHealthSnapshot.unknown(sourceId);
        }
    }

    public List<SourceHealthListing> getAllSourceHealth() {
        try {
            List<SourceHealthEntity> rows = repository.findAllByOrderByUpdatedAtDesc();
            Map<String, String> names = companyRepository
                    .findAllById(rows.stream().map(SourceHealthEntity::getSourceId).toList())
                    .stream()
                    .collect(Collectors.toMap(CompanyEntity::getId, CompanyEntity::getCompanyName, (a, b) -> a));
            Instant now = clock.instant();
            return rows.stream().map(row -> toListing(row, names, now)).toList();
        } catch (RuntimeException e) {
            log.error("Failed to get all source health", e);
            return List.of();
        }
    }

    /**
     * Puts a Source back to the zero state. Unlike recording, failures propagate to the operator.
     */
    public SourceHealthSnapshot resetSourceHealth(String sourceId, String resetBy) {
        SourceHealthEntity entity = recorder.reset(sourceId, blankToNull(resetBy));
        metrics.setHealthy(sourceId, true);
        log.info("Reset source health sourceId={} resetBy={}", sourceId, resetBy);
        return toSnapshot(entity);
    }

    /**
     * @return how many Sources were reset
     */
    public int resetAllSourceHealth(String resetBy) {
        List<String> sourceIds = companyRepository.findByType(CompanyType.SOURCE).stream()
                .map(CompanyEntity::getId)
                .toList();
        for (String sourceId : sourceIds) {
            resetSourceHealth(sourceId, resetBy);
        }
        log.info("Reset health for all sources count={} resetBy={}", sourceIds.size(), resetBy);
        return sourceIds.size();
    }

    public boolean isKnownSource(String sourceId) {
        return companyRepository.existsByIdAndType(sourceId, CompanyType.SOURCE);
    }

    SourceHealthStatus statusOf(HealthCounters counters, Instant now) {
        if (counters.excludedAt(now)) return SourceHealthStatus.EXCLUDED;
        if (counters.slowRate() > properties.statusSlowRateThreshold()) return SourceHealthStatus.SLOW;
        return SourceHealthStatus.HEALTHY;
    }

    private SourceHealthSnapshot toSnapshot(SourceHealthEntity e) {
        return new SourceHealthSnapshot(
                e.getSourceId(),
                backoffPolicy.isHealthy(e.counters(), clock.instant()),
                e.getSlowRate(),
                e.getSampleCount(),
                e.getSlowCount(),
                e.getStrikeCount(),
                e.getBackoffLevel(),
                e.getExcludedUntil(),
                e.getLastStrikeAt(),
                e.getLastResetBy(),
                e.getLastResetAt(),
                e.getUpdatedAt()
        );
    }

    private SourceHealthListing toListing(SourceHealthEntity e, Map<String, String> names, Instant now) {
        HealthCounters counters = e.counters();
        return new SourceHealthListing(
                e.getSourceId(),
                names.getOrDefault(e.getSourceId(), UNKNOWN_COMPANY),
                statusOf(counters, now),
                backoffPolicy.isHealthy(counters, now),
                e.getSlowRate(),
                e.getSampleCount(),
                e.getStrikeCount(),
                e.getBackoffLevel(),
                e.getExcludedUntil(),
                e.getUpdatedAt()
        );
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
