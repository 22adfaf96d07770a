/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.domain.model;

/**
 * Operator-facing label for a Source. Evaluated in declaration order of priority:
 * an active exclusion wins over a high slow rate.
 */
public enum SourceHealthStatus {
    EXCLUDED,
    SLOW,
    HEALTHY
}
