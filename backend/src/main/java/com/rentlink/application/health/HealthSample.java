/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

/**
 * One observed upstream call to a Source.
 */
public record HealthSample(String sourceId, long latencyMs, boolean success) {}
