/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class SourceHealthMetrics {
    public static final String EXCLUSION_TOTAL = "source_exclusion_total";
    public static final String HEALTH_STATUS = "source_health_status";
    public static final String SAMPLES_DROPPED_TOTAL = "source_health_samples_dropped_total";

    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, AtomicInteger> healthStatus = new ConcurrentHashMap<>();
    private final Counter samplesDropped;

    public SourceHealthMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.samplesDropped = Counter.builder(SAMPLES_DROPPED_TOTAL)
                .description("Health samples dropped because the recording queue was full")
                .register(meterRegistry);
    }

    public void recordExclusion(String sourceId, String reason) {
        Counter.builder(EXCLUSION_TOTAL)
                .description("Total number of source exclusions due to health issues")
                .tag("source_id", sourceId)
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void setHealthy(String sourceId, boolean healthy) {
        healthStatus.computeIfAbsent(sourceId, this::registerStatusGauge).set(healthy ? 1 : 0);
    }

    public void recordSampleDropped() {
        samplesDropped.increment();
    }

    private AtomicInteger registerStatusGauge(String sourceId) {
        AtomicInteger holder = new AtomicInteger(1);
        Gauge.builder(HEALTH_STATUS, holder, AtomicInteger::get)
                .description("Source health status (1 = healthy, 0 = unhealthy)")
                .tag("source_id", sourceId)
                .register(meterRegistry);
        return holder;
    }
}
