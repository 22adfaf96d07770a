/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.application.health.policy.BackoffDecision;
import com.rentlink.application.health.policy.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Applies one sample and publishes its effects. Failures are logged and the sample is lost;
 * they never reach the caller that made the upstream call.
 */
@Component
public class SourceMetricProcessor {
    private static final Logger log = LoggerFactory.getLogger(SourceMetricProcessor.class);

    private final SourceHealthRecorder recorder;
    private final BackoffPolicy backoffPolicy;
    private final SourceHealthMetrics metrics;
    private final Clock clock;

    public SourceMetricProcessor(
            SourceHealthRecorder recorder,
            BackoffPolicy backoffPolicy,
            SourceHealthMetrics metrics,
            Clock clock
    ) {
        this.recorder = recorder;
        this.backoffPolicy = backoffPolicy;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void process(HealthSample sample) {
        try {
            SampleOutcome outcome = recorder.record(sample);
            BackoffDecision decision = outcome.decision();

            switch (decision.transition()) {
                case BACKOFF_APPLIED -> {
                    metrics.recordExclusion(sample.sourceId(), backoffPolicy.exclusionReason());
                    log.warn("Applied backoff to source sourceId={} backoffLevel={} backoffMinutes={} excludedUntil={}",
                            sample.sourceId(),
                            decision.backoffLevel(),
                            backoffMinutes(decision.excludedUntil()),
                            decision.excludedUntil());
                }
                case BACKOFF_RESET -> log.info("Reset backoff for source (recovered) sourceId={}", sample.sourceId());
                case NONE -> {
                }
            }

            metrics.setHealthy(sample.sourceId(), outcome.healthy());

            log.debug("Source health metric recorded sourceId={} latencyMs={} success={} slow={} strikeCount={} slowRate={} sampleCount={} backoffLevel={}",
                    sample.sourceId(),
                    sample.latencyMs(),
                    sample.success(),
                    outcome.slow(),
                    outcome.counters().strikeCount(),
                    outcome.counters().slowRate(),
                    outcome.counters().sampleCount(),
                    outcome.counters().backoffLevel());
        } catch (RuntimeException e) {
            log.error("Failed to record health metric sourceId={}", sample.sourceId(), e);
        }
    }

    private long backoffMinutes(Instant excludedUntil) {
        if (excludedUntil == null) return 0;
        return Math.max(0, Duration.between(clock.instant(), excludedUntil).toMinutes());
    }
}
