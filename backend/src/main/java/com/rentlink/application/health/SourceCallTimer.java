/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Wraps an upstream call to a Source: times it, records the sample, and hands back the call's
 * own result or exception untouched.
 */
@Component
public class SourceCallTimer {
    private final SourceHealthService healthService;

    public SourceCallTimer(SourceHealthService healthService) {
        this.healthService = healthService;
    }

    public <T> T call(String sourceId, Callable<T> upstreamCall) throws Exception {
        long start = System.nanoTime();
        boolean success = false;
        try {
            T result = upstreamCall.call();
            success = true;
            return result;
        } finally {
            long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            healthService.recordMetric(sourceId, latencyMs, success);
        }
    }
}
