/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health.policy;

import com.rentlink.config.HealthMonitorProperties;
import com.rentlink.domain.model.BackoffPolicyMode;
import com.rentlink.domain.model.HealthCounters;

import java.time.Duration;
import java.time.Instant;

/**
 * Lifetime slow-rate policy. Once a Source has enough samples and its slow rate is over the
 * threshold, every further sample escalates the level and excludes it for 2^level hours,
 * capped at the maximum window. Dropping back under the threshold recovers it.
 * Strikes are still counted for display but play no part in the decision.
 */
public class SlowRateBackoffPolicy implements BackoffPolicy {
    public static final String REASON = "slow_rate";

    private static final int MAX_SHIFT = 30;

    private final long minSamples;
    private final double threshold;
    private final Duration maxBackoff;
    private final int maxLevel;

    public SlowRateBackoffPolicy(HealthMonitorProperties.SlowRate settings) {
        this.minSamples = settings.minSamples();
        this.threshold = settings.threshold();
        this.maxBackoff = settings.maxBackoff();
        this.maxLevel = settings.maxLevel();
    }

    @Override
    public BackoffDecision onSample(HealthCounters counters, boolean slow, Instant now) {
        int strikes = slow ? counters.strikeCount() + 1 : 0;

        if (counters.sampleCount() >= minSamples && counters.slowRate() > threshold) {
            int level = Math.min(counters.backoffLevel() + 1, maxLevel);
            return BackoffDecision.applied(level, now.plus(windowFor(level)), strikes);
        }
        if (counters.slowRate() <= threshold && counters.backoffLevel() > 0) {
            return BackoffDecision.reset(strikes);
        }
        return BackoffDecision.unchanged(strikes, counters.backoffLevel(), counters.excludedUntil());
    }

    @Override
    public boolean isHealthy(HealthCounters counters, Instant now) {
        return counters.slowRate() <= threshold && counters.excludedUntil() == null;
    }

    public Duration windowFor(int level) {
        Duration window = Duration.ofHours(1L << Math.min(Math.max(level, 0), MAX_SHIFT));
        return window.compareTo(maxBackoff) > 0 ? maxBackoff : window;
    }

    @Override
    public String exclusionReason() {
        return REASON;
    }

    @Override
    public BackoffPolicyMode mode() {
        return BackoffPolicyMode.SLOW_RATE;
    }
}
