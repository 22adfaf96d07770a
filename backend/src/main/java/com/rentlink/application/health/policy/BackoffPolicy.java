/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health.policy;

import com.rentlink.domain.model.BackoffPolicyMode;
import com.rentlink.domain.model.HealthCounters;

import java.time.Instant;

/**
 * Decides exclusion windows for a Source from its health counters.
 * Implementations are pure: no I/O, time comes in as an argument.
 */
public interface BackoffPolicy {

    /**
     * @param counters counters that already include the sample being applied
     * @param slow     whether that sample was slow
     * @param now      the time the sample is applied
     */
    BackoffDecision onSample(HealthCounters counters, boolean slow, Instant now);

    boolean isHealthy(HealthCounters counters, Instant now);

    /**
     * Value of the {@code reason} tag on the exclusion counter.
     */
    String exclusionReason();

    BackoffPolicyMode mode();
}
