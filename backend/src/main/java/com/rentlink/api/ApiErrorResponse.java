/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
