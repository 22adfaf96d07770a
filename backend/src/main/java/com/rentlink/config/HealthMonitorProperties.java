/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.config;

import com.rentlink.domain.model.BackoffPolicyMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Settings of the Source health monitor. Missing values fall back to the production defaults,
 * so {@code new HealthMonitorProperties(true, 0, null, null, null, 0, null)} is a usable
 * enabled configuration.
 *
 * @param enabled                 when false, recording and exclusion checks are no-ops
 * @param slowThresholdMs         a sample slower than this is a slow sample
 * @param policy                  which backoff policy decides exclusions
 * @param strikes                 strike policy settings
 * @param slowRate                slow-rate policy settings
 * @param statusSlowRateThreshold slow rate above which listings label a Source SLOW
 * @param dispatcher              async recording queue settings
 */
@ConfigurationProperties(prefix = "app.health")
public record HealthMonitorProperties(
        boolean enabled,
        long slowThresholdMs,
        BackoffPolicyMode policy,
        Strikes strikes,
        SlowRate slowRate,
        double statusSlowRateThreshold,
        Dispatcher dispatcher
) {
    public static final long DEFAULT_SLOW_THRESHOLD_MS = 3000;
    public static final double DEFAULT_STATUS_SLOW_RATE_THRESHOLD = 0.5;

    public HealthMonitorProperties {
        if (slowThresholdMs <= 0) slowThresholdMs = DEFAULT_SLOW_THRESHOLD_MS;
        if (policy == null) policy = BackoffPolicyMode.STRIKES;
        if (strikes == null) strikes = new Strikes(0, null);
        if (slowRate == null) slowRate = new SlowRate(0, 0, null, 0);
        if (statusSlowRateThreshold <= 0) statusSlowRateThreshold = DEFAULT_STATUS_SLOW_RATE_THRESHOLD;
        if (dispatcher == null) dispatcher = new Dispatcher(0, 0, null);
    }

    public static HealthMonitorProperties defaults(boolean enabled) {
        return new HealthMonitorProperties(enabled, 0, null, null, null, 0, null);
    }

    public record Strikes(int strikesForBackoff, List<Duration> ladder) {
        public static final List<Duration> DEFAULT_LADDER = List.of(
                Duration.ofMinutes(15),
                Duration.ofMinutes(30),
                Duration.ofMinutes(60),
                Duration.ofHours(2),
                Duration.ofHours(4)
        );

        public Strikes {
            if (strikesForBackoff <= 0) strikesForBackoff = 3;
            ladder = ladder == null || ladder.isEmpty() ? DEFAULT_LADDER : List.copyOf(ladder);
        }
    }

    public record SlowRate(long minSamples, double threshold, Duration maxBackoff, int maxLevel) {
        public SlowRate {
            if (minSamples <= 0) minSamples = 100;
            if (threshold <= 0) threshold = 0.2;
            if (maxBackoff == null) maxBackoff = Duration.ofHours(24);
            if (maxLevel <= 0) maxLevel = 10;
        }
    }

    public record Dispatcher(int queueCapacity, int workerThreads, Duration shutdownTimeout) {
        public Dispatcher {
            if (queueCapacity <= 0) queueCapacity = 10_000;
            if (workerThreads <= 0) workerThreads = 2;
            if (shutdownTimeout == null) shutdownTimeout = Duration.ofSeconds(10);
        }
    }
}
