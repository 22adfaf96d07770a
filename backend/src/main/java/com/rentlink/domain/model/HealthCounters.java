/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.domain.model;

import java.time.Instant;

/**
 * Read-only view of a Source's health row, the input every backoff decision is made from.
 */
public record HealthCounters(
        long sampleCount,
        long slowCount,
        double slowRate,
        int strikeCount,
        int backoffLevel,
        Instant excludedUntil
) {
    public static HealthCounters empty() {
        return new HealthCounters(0, 0, 0, 0, 0, null);
    }

    /**
     * An exclusion whose deadline has passed counts as no exclusion.
     */
    public boolean excludedAt(Instant now) {
        return excludedUntil != null && excludedUntil.isAfter(now);
    }
}
