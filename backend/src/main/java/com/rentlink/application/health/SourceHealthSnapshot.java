/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import java.time.Instant;

public record SourceHealthSnapshot(
        String sourceId,
        boolean healthy,
        double slowRate,
        long sampleCount,
        long slowCount,
        int strikeCount,
        int backoffLevel,
        Instant excludedUntil,
        Instant lastStrikeAt,
        String lastResetBy,
        Instant lastResetAt,
        Instant updatedAt
) {
    public static SourceHealthSnapshot unknown(String sourceId) {
        return new SourceHealthSnapshot(sourceId, true, 0, 0, 0, 0, 0, null, null, null, null, null);
    }
}
