/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.domain.security;

public record SourcePrincipal(String sourceId, String companyName) {}
