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
import java.util.List;

/**
 * Consecutive-strike policy: N slow samples in a row exclude the Source for the next
 * step of the ladder (15m, 30m, 60m, 2h, 4h by default). Escalation only climbs while
 * an exclusion is still running; otherwise it starts again at level 1. A single fast
 * sample recovers the Source at once.
 */
public class StrikeBackoffPolicy implements BackoffPolicy {
    public static final String REASON = "strikes";

    private final int strikesForBackoff;
    private final List<Duration> ladder;

    public StrikeBackoffPolicy(HealthMonitorProperties.Strikes settings) {
        this.strikesForBackoff = settings.strikesForBackoff();
        this.ladder = settings.ladder();
    }

    @Override
    public BackoffDecision onSample(HealthCounters counters, boolean slow, Instant now) {
        if (!slow) {
            if (counters.backoffLevel() > 0) {
                return BackoffDecision.reset(0);
            }
            return BackoffDecision.unchanged(0, counters.backoffLevel(), counters.excludedUntil());
        }

        int strikes = counters.strikeCount() + 1;
        if (strikes < strikesForBackoff) {
            return BackoffDecision.unchanged(strikes, counters.backoffLevel(), counters.excludedUntil());
        }

        int level = counters.excludedAt(now)
                ? Math.min(counters.backoffLevel() + 1, ladder.size())
                : 1;
        return BackoffDecision.applied(level, now.plus(windowFor(level)), 0);
    }

    @Override
    public boolean isHealthy(HealthCounters counters, Instant now) {
        return counters.strikeCount() < strikesForBackoff && !counters.excludedAt(now);
    }

    /**
     * Exclusion window for a 1-based level, clamped to the last ladder step.
     */
    public Duration windowFor(int level) {
        int index = Math.max(0, Math.min(level, ladder.size()) - 1);
        return ladder.get(index);
    }

    public int maxLevel() {
        return ladder.size();
    }

    @Override
    public String exclusionReason() {
        return REASON;
    }

    @Override
    public BackoffPolicyMode mode() {
        return BackoffPolicyMode.STRIKES;
    }
}
