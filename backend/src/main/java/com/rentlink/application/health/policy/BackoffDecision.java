/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health.policy;

import java.time.Instant;

public record BackoffDecision(
        int strikeCount,
        int backoffLevel,
        Instant excludedUntil,
        Transition transition
) {
    public enum Transition {
        NONE,
        BACKOFF_APPLIED,
        BACKOFF_RESET
    }

    public static BackoffDecision applied(int backoffLevel, Instant excludedUntil, int strikeCount) {
        return new BackoffDecision(strikeCount, backoffLevel, excludedUntil, Transition.BACKOFF_APPLIED);
    }

    public static BackoffDecision reset(int strikeCount) {
        return new BackoffDecision(strikeCount, 0, null, Transition.BACKOFF_RESET);
    }

    public static BackoffDecision unchanged(int strikeCount, int backoffLevel, Instant excludedUntil) {
        return new BackoffDecision(strikeCount, backoffLevel, excludedUntil, Transition.NONE);
    }
}
