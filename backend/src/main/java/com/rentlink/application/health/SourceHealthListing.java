/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.domain.model.SourceHealthStatus;

import java.time.Instant;

public record SourceHealthListing(
        String sourceId,
        String companyName,
        SourceHealthStatus status,
        boolean healthy,
        double slowRate,
        long sampleCount,
        int strikeCount,
        int backoffLevel,
        Instant excludedUntil,
        Instant updatedAt
) {}
