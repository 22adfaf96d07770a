/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.application.health.policy.BackoffDecision;
import com.rentlink.domain.model.HealthCounters;

public record SampleOutcome(
        HealthSample sample,
        boolean slow,
        HealthCounters counters,
        BackoffDecision decision,
        boolean healthy
) {}
